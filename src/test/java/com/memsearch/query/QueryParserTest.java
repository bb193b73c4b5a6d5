package com.memsearch.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.memsearch.text.LowercaseNormalizer;
import com.memsearch.text.WordTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QueryParserTest {
    @Test
    void testSimpleTerm() {
        QueryNode node = parse("hello");
        assertEquals(new QueryNode.TermQuery("hello"), node);
    }

    @Test
    void testImplicitAnd() {
        QueryNode node = parse("hello world");
        QueryNode.BooleanQuery booleanQuery = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.AND, booleanQuery.op());
    }

    @Test
    void testImplicitOperatorFollowsDefault() {
        QueryNode node = parser(QueryNode.BoolOp.OR).parse("hello world");
        QueryNode.BooleanQuery booleanQuery = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.OR, booleanQuery.op());
    }

    @Test
    void testOperatorsAreCaseInsensitive() {
        QueryNode node = parse("water or toxic");
        QueryNode.BooleanQuery booleanQuery = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.OR, booleanQuery.op());
    }

    @Test
    void testAndBindsTighterThanOr() {
        QueryNode node = parse("a OR b AND c");
        QueryNode.BooleanQuery root = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.OR, root.op());
        assertEquals(new QueryNode.TermQuery("a"), root.left());
        QueryNode.BooleanQuery right = assertInstanceOf(QueryNode.BooleanQuery.class, root.right());
        assertEquals(QueryNode.BoolOp.AND, right.op());
    }

    @Test
    void testOperatorsAreLeftAssociative() {
        QueryNode node = parse("a AND b AND c");
        QueryNode.BooleanQuery root = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertInstanceOf(QueryNode.BooleanQuery.class, root.left());
        assertEquals(new QueryNode.TermQuery("c"), root.right());
    }

    @Test
    void testGroup() {
        QueryNode node = parse("error AND (timeout OR retry)");
        QueryNode.BooleanQuery root = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.AND, root.op());
        QueryNode.BooleanQuery grouped = assertInstanceOf(QueryNode.BooleanQuery.class, root.right());
        assertEquals(QueryNode.BoolOp.OR, grouped.op());
    }

    @Test
    void testTermsAreNormalizedLikeDocuments() {
        assertEquals(new QueryNode.TermQuery("prøve"), parse("PRØVE"));
    }

    @Test
    void testCompoundWordSplitsIntoAdjacentTerms() {
        assertEquals(new QueryNode.BooleanQuery(QueryNode.BoolOp.AND,
            new QueryNode.TermQuery("foo"), new QueryNode.TermQuery("bar")), parse("foo-bar"));
        assertEquals(new QueryNode.BooleanQuery(QueryNode.BoolOp.OR,
            new QueryNode.TermQuery("foo"), new QueryNode.TermQuery("bar")), parser(QueryNode.BoolOp.OR).parse("foo-bar"));
    }

    @Test
    void testOperatorWordInsideCompoundIsAnOperator() {
        QueryNode node = parse("water-or-toxic");
        QueryNode.BooleanQuery booleanQuery = assertInstanceOf(QueryNode.BooleanQuery.class, node);
        assertEquals(QueryNode.BoolOp.OR, booleanQuery.op());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "...", "hiv AND", "OR hiv", "(hiv", "hiv)", "()", "( ! )", "hiv AND OR protein"})
    void testSyntaxErrors(String query) {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse(query));
        assertTrue(exception.getMessage().contains("^"));
        assertEquals(query, exception.getQueryString());
    }

    @Test
    void testNullQueryRejected() {
        assertThrows(QueryParseException.class, () -> parse(null));
    }

    @Test
    void testErrorPositionAndSuggestion() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse("(water OR toxic"));
        assertEquals(15, exception.getPosition());
        assertTrue(exception.getSuggestion().contains("括号"));
    }

    @Test
    void testTrailingParenthesisSuggestion() {
        QueryParseException exception = assertThrows(QueryParseException.class, () -> parse("water) OR toxic"));
        assertEquals(5, exception.getPosition());
        assertTrue(exception.getSuggestion().contains("右括号"));
    }

    @Test
    void testParserIsReusable() {
        QueryParser parser = parser(QueryNode.BoolOp.AND);
        assertThrows(QueryParseException.class, () -> parser.parse("(hiv"));
        assertEquals(new QueryNode.TermQuery("hiv"), parser.parse("hiv"));
    }

    private QueryNode parse(String query) {
        return parser(QueryNode.BoolOp.AND).parse(query);
    }

    private static QueryParser parser(QueryNode.BoolOp defaultOperator) {
        return new QueryParser(new QueryLexer(new WordTokenizer(), new LowercaseNormalizer()), defaultOperator);
    }
}
