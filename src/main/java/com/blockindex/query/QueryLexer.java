package com.blockindex.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 查询词法分析：括号、双引号词项、关键字 AND/OR/NOT（不区分大小写）与裸词。
 *
 * 紧贴在词前的 '-' 视为 NOT；单独出现的 '-' 是普通词。词项在这里不做分词，交给查询引擎按索引同样的规则切分。
 */
public class QueryLexer {
    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "AND", TokenType.AND,
        "OR", TokenType.OR,
        "NOT", TokenType.NOT
    );

    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new QueryParseException(QueryParseException.Reason.EMPTY_QUERY, "查询字符串为null", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        int cursor = 0;
        while (true) {
            while (cursor < query.length() && Character.isWhitespace(query.charAt(cursor))) {
                cursor++;
            }
            if (cursor >= query.length()) {
                break;
            }

            char current = query.charAt(cursor);
            switch (current) {
                case '(':
                    tokens.add(new LexToken(TokenType.LPAREN, "(", cursor++));
                    break;
                case ')':
                    tokens.add(new LexToken(TokenType.RPAREN, ")", cursor++));
                    break;
                case '"':
                    cursor = scanQuoted(query, cursor, tokens);
                    break;
                case '-':
                    if (prefixesClause(query, cursor + 1)) {
                        tokens.add(new LexToken(TokenType.NOT, "-", cursor++));
                    } else {
                        cursor = scanWord(query, cursor, tokens);
                    }
                    break;
                default:
                    cursor = scanWord(query, cursor, tokens);
                    break;
            }
        }
        tokens.add(new LexToken(TokenType.EOF, "", query.length()));
        return tokens;
    }

    private boolean prefixesClause(String query, int next) {
        if (next >= query.length()) {
            return false;
        }
        char following = query.charAt(next);
        return !Character.isWhitespace(following) && following != ')' && following != '-';
    }

    private int scanWord(String query, int start, List<LexToken> tokens) {
        int end = start;
        while (end < query.length() && !isWordBoundary(query.charAt(end))) {
            end++;
        }
        String word = query.substring(start, end);
        TokenType keyword = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
        tokens.add(new LexToken(keyword == null ? TokenType.TERM : keyword, word, start));
        return end;
    }

    private boolean isWordBoundary(char ch) {
        return Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"';
    }

    /**
     * 引号内按字面读取，只识别 \" 与 \\ 两种转义；关键字在引号内是普通词项。
     */
    private int scanQuoted(String query, int openQuote, List<LexToken> tokens) {
        StringBuilder literal = new StringBuilder();
        int cursor = openQuote + 1;
        while (cursor < query.length()) {
            char ch = query.charAt(cursor);
            if (ch == '"') {
                if (literal.length() == 0) {
                    throw new QueryParseException(QueryParseException.Reason.EMPTY_QUOTED_TERM,
                        "引号内词项为空", openQuote, query);
                }
                tokens.add(new LexToken(TokenType.TERM, literal.toString(), openQuote));
                return cursor + 1;
            }
            if (ch == '\\' && cursor + 1 < query.length()
                    && (query.charAt(cursor + 1) == '"' || query.charAt(cursor + 1) == '\\')) {
                literal.append(query.charAt(cursor + 1));
                cursor += 2;
                continue;
            }
            literal.append(ch);
            cursor++;
        }
        throw new QueryParseException(QueryParseException.Reason.UNCLOSED_QUOTE,
            "引号未闭合", openQuote, query);
    }
}
