package com.blockindex.query;

/**
 * 查询词法单元。
 *
 * @param type 类别
 * @param value 原文；引号词项为去掉引号与转义后的内容
 * @param position 在查询字符串中的起始下标
 */
public record LexToken(TokenType type, String value, int position) {

    boolean isOperator() {
        return type == TokenType.AND || type == TokenType.OR || type == TokenType.NOT;
    }
}

enum TokenType {
    TERM,
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    EOF
}
