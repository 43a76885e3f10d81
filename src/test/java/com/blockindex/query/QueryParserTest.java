package com.blockindex.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.blockindex.query.QueryNode.and;
import static com.blockindex.query.QueryNode.not;
import static com.blockindex.query.QueryNode.or;
import static com.blockindex.query.QueryNode.term;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询解析器单元测试。
 */
class QueryParserTest {

    private final QueryParser parser = new QueryParser();

    @Test
    void testSingleTerm() {
        assertEquals(term("input"), parser.parse("input"));
    }

    @Test
    @DisplayName("NOT优先于AND，AND优先于OR")
    void testPrecedence() {
        assertEquals(or(term("a"), and(term("b"), not(term("c")))), parser.parse("a OR b AND NOT c"));
        assertEquals(or(and(term("a"), term("b")), term("c")), parser.parse("a AND b OR c"));
    }

    @Test
    void testLeftAssociativity() {
        assertEquals(or(or(term("a"), term("b")), term("c")), parser.parse("a OR b OR c"));
        assertEquals(and(and(term("a"), term("b")), term("c")), parser.parse("a AND b AND c"));
    }

    @Test
    void testParenthesesOverridePrecedence() {
        assertEquals(and(term("a"), or(term("b"), term("c"))), parser.parse("a AND (b OR c)"));
    }

    @Test
    void testImplicitAnd() {
        assertEquals(and(and(term("a"), term("b")), not(term("c"))), parser.parse("a b -c"));
    }

    @Test
    void testKeywordsAreCaseInsensitive() {
        assertEquals(or(term("a"), not(term("b"))), parser.parse("a or not b"));
    }

    @Test
    @DisplayName("引号内容按字面词项处理，包括关键字")
    void testQuotedTerms() {
        assertEquals(or(term("был"), not(and(term("input"), term("users")))),
            parser.parse("\"был\" OR NOT(\"input\" AND \"users\")"));
        assertEquals(and(term("AND"), term("a \"b\"")), parser.parse("\"AND\" \"a \\\"b\\\"\""));
    }

    @Test
    void testNestedNot() {
        assertEquals(not(not(term("a"))), parser.parse("NOT NOT a"));
        assertEquals(not(term("a")), parser.parse("-a"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "''        | EMPTY_QUERY",
        "'   '     | EMPTY_QUERY",
        "(a OR b   | UNBALANCED_PARENTHESES",
        "(         | UNBALANCED_PARENTHESES",
        "a )       | UNBALANCED_PARENTHESES",
        ") a       | UNBALANCED_PARENTHESES",
        "()        | EMPTY_GROUP",
        "a AND     | DANGLING_OPERATOR",
        "AND a     | DANGLING_OPERATOR",
        "a OR OR b | DANGLING_OPERATOR",
        "NOT       | DANGLING_OPERATOR",
        "\"open   | UNCLOSED_QUOTE",
        "\"\"       | EMPTY_QUOTED_TERM"
    })
    @DisplayName("语法错误按类别报告")
    void testSyntaxErrors(String query, QueryParseException.Reason reason) {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parser.parse(query));
        assertEquals(reason, exception.getReason());
        assertFalse(exception.getSuggestion().isBlank());
    }

    @Test
    void testUnclosedGroupPointsAtOpeningParenthesis() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parser.parse("a AND (b"));

        assertEquals(6, exception.getPosition());
        assertEquals("a AND (b", exception.getQueryString());
        assertTrue(exception.getMessage().contains("左括号未闭合"));
        assertTrue(exception.getSuggestion().contains("括号"));
    }

    @Test
    void testDanglingOperatorPointsAtOperator() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parser.parse("был OR"));

        assertEquals(4, exception.getPosition());
        assertTrue(exception.getMessage().contains("OR"));
        assertTrue(exception.getSuggestion().contains("\"AND\""));
    }

    @Test
    void testLoneDashIsATerm() {
        assertEquals(and(term("a"), term("-")), parser.parse("a -"));
        assertEquals(term("--x"), parser.parse("--x"));
    }

    @Test
    void testNullQueryIsRejected() {
        assertThrows(QueryParseException.class, () -> parser.parse(null));
    }

    @Test
    void testLexerTokens() {
        List<LexToken> tokens = new QueryLexer().tokenize("a-b -c (d)");

        assertEquals(List.of(
            new LexToken(TokenType.TERM, "a-b", 0),
            new LexToken(TokenType.NOT, "-", 4),
            new LexToken(TokenType.TERM, "c", 5),
            new LexToken(TokenType.LPAREN, "(", 7),
            new LexToken(TokenType.TERM, "d", 8),
            new LexToken(TokenType.RPAREN, ")", 9),
            new LexToken(TokenType.EOF, "", 10)
        ), tokens);
    }
}
