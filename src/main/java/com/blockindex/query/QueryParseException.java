package com.blockindex.query;

/**
 * 查询语法错误，携带出错位置与错误类别。
 */
public class QueryParseException extends RuntimeException {

    /** 查询语法可能出现的错误类别 */
    public enum Reason {
        EMPTY_QUERY,
        UNBALANCED_PARENTHESES,
        EMPTY_GROUP,
        DANGLING_OPERATOR,
        UNCLOSED_QUOTE,
        EMPTY_QUOTED_TERM
    }

    private final Reason reason;
    private final int position;
    private final String queryString;

    public QueryParseException(Reason reason, String detail, int position, String queryString) {
        super(formatMessage(detail, position, queryString == null ? "" : queryString));
        this.reason = reason;
        this.position = position;
        this.queryString = queryString == null ? "" : queryString;
    }

    public Reason getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    /**
     * 针对错误类别给出修改建议。
     */
    public String getSuggestion() {
        switch (reason) {
            case EMPTY_QUERY:
                return "请输入至少一个词项，例如: input AND users";
            case UNBALANCED_PARENTHESES:
                return "左右括号需要成对出现，请补全或删除多余的括号";
            case EMPTY_GROUP:
                return "括号内至少需要一个词项，例如: (input OR users)";
            case DANGLING_OPERATOR:
                return "AND/OR 两侧以及 NOT 之后都需要词项或括号表达式；关键字本身作为词项时请加双引号，如 \"AND\"";
            case UNCLOSED_QUOTE:
                return "请在词项末尾补上右引号";
            case EMPTY_QUOTED_TERM:
                return "引号内至少需要一个字符，或删除这对空引号";
            default:
                return "请检查查询语法";
        }
    }

    private static String formatMessage(String detail, int position, String query) {
        int caret = Math.max(0, Math.min(position, query.length()));
        return detail + " (位置 " + position + ")" + System.lineSeparator()
            + query + System.lineSeparator()
            + " ".repeat(caret) + "^";
    }
}
