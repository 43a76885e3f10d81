package com.blockindex.text;

/**
 * 分词器产出的词法单元。
 *
 * @param text 原文片段
 * @param punctuation 分词器是否将其识别为标点
 */
public record Token(
    String text,
    boolean punctuation
) {
    public Token {
        if (text == null) {
            throw new IllegalArgumentException("token 文本不能为null");
        }
    }
}
