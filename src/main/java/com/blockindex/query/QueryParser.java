package com.blockindex.query;

import java.util.List;

/**
 * 布尔查询解析器（优先级爬升）。
 *
 * 优先级 NOT &gt; AND &gt; OR，二元运算左结合；两个相邻子句之间补一个隐式 AND。
 */
public class QueryParser {
    private static final int OR_PRECEDENCE = 1;
    private static final int AND_PRECEDENCE = 2;

    /**
     * 将查询字符串解析为 AST。
     *
     * @throws QueryParseException 语法错误时抛出
     */
    public QueryNode parse(String query) {
        Cursor cursor = new Cursor(new QueryLexer().tokenize(query), query);
        if (cursor.peek().type() == TokenType.EOF) {
            throw new QueryParseException(QueryParseException.Reason.EMPTY_QUERY, "查询为空", 0, cursor.query);
        }

        QueryNode root = parseBinary(cursor, OR_PRECEDENCE);
        LexToken trailing = cursor.peek();
        if (trailing.type() != TokenType.EOF) {
            // 循环只会停在 EOF 或右括号
            throw new QueryParseException(QueryParseException.Reason.UNBALANCED_PARENTHESES,
                "多余的右括号", trailing.position(), cursor.query);
        }
        return root;
    }

    private QueryNode parseBinary(Cursor cursor, int minPrecedence) {
        QueryNode left = parseUnary(cursor);
        while (true) {
            LexToken next = cursor.peek();
            QueryNode.BoolOp op;
            boolean explicit = true;
            if (next.type() == TokenType.OR) {
                op = QueryNode.BoolOp.OR;
            } else if (next.type() == TokenType.AND) {
                op = QueryNode.BoolOp.AND;
            } else if (startsOperand(next.type())) {
                op = QueryNode.BoolOp.AND;
                explicit = false;
            } else {
                return left;
            }

            int precedence = op == QueryNode.BoolOp.OR ? OR_PRECEDENCE : AND_PRECEDENCE;
            if (precedence < minPrecedence) {
                return left;
            }
            if (explicit) {
                cursor.advance();
            }
            QueryNode right = parseBinary(cursor, precedence + 1);
            left = new QueryNode.BooleanQuery(op, left, right);
        }
    }

    private QueryNode parseUnary(Cursor cursor) {
        LexToken token = cursor.peek();
        switch (token.type()) {
            case NOT:
                cursor.advance();
                return new QueryNode.NotQuery(parseUnary(cursor));
            case TERM:
                cursor.advance();
                return new QueryNode.TermQuery(token.value());
            case LPAREN:
                cursor.advance();
                if (cursor.peek().type() == TokenType.RPAREN) {
                    throw new QueryParseException(QueryParseException.Reason.EMPTY_GROUP,
                        "括号内没有表达式", token.position(), cursor.query);
                }
                QueryNode grouped = parseBinary(cursor, OR_PRECEDENCE);
                if (cursor.peek().type() != TokenType.RPAREN) {
                    throw new QueryParseException(QueryParseException.Reason.UNBALANCED_PARENTHESES,
                        "左括号未闭合", token.position(), cursor.query);
                }
                cursor.advance();
                return grouped;
            default:
                throw missingOperand(cursor, token);
        }
    }

    private QueryParseException missingOperand(Cursor cursor, LexToken token) {
        LexToken previous = cursor.previous();
        if (previous != null && previous.isOperator()) {
            return new QueryParseException(QueryParseException.Reason.DANGLING_OPERATOR,
                "运算符 " + previous.value() + " 缺少右操作数", previous.position(), cursor.query);
        }
        if (token.isOperator()) {
            return new QueryParseException(QueryParseException.Reason.DANGLING_OPERATOR,
                "运算符 " + token.value() + " 缺少左操作数", token.position(), cursor.query);
        }
        if (token.type() == TokenType.RPAREN) {
            return new QueryParseException(QueryParseException.Reason.UNBALANCED_PARENTHESES,
                "多余的右括号", token.position(), cursor.query);
        }
        // 剩下的只有左括号之后直接结束
        return new QueryParseException(QueryParseException.Reason.UNBALANCED_PARENTHESES,
            "左括号未闭合", previous == null ? token.position() : previous.position(), cursor.query);
    }

    private boolean startsOperand(TokenType type) {
        return type == TokenType.TERM || type == TokenType.LPAREN || type == TokenType.NOT;
    }

    private static final class Cursor {
        private final List<LexToken> tokens;
        private final String query;
        private int index;

        private Cursor(List<LexToken> tokens, String query) {
            this.tokens = tokens;
            this.query = query;
        }

        private LexToken peek() {
            return tokens.get(index);
        }

        private LexToken previous() {
            return index == 0 ? null : tokens.get(index - 1);
        }

        private void advance() {
            index++;
        }
    }
}
