package com.challenges.stagedb.predicate;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class PredicateParserTest {
    private final PredicateParser parser = new PredicateParser();

    private static Predicate.Leaf leaf(String column, Operator operator, Object operand) {
        return new Predicate.Leaf(column, operator, operand);
    }

    // ============================================================
    // Leaves
    // ============================================================

    @Test
    public void testSimpleComparison() {
        assertEquals(leaf("age", Operator.GREATER_THAN, 25L), parser.parse("age > 25"));
        assertEquals(leaf("salary", Operator.LESS_EQUAL, 1500.5), parser.parse("salary <= 1500.5"));
        assertEquals(leaf("name", Operator.EQUALS, "Alice"), parser.parse("name = 'Alice'"));
        assertEquals(leaf("delta", Operator.GREATER_EQUAL, -3L), parser.parse("delta >= -3"));
    }

    @Test
    public void testBothInequalitySpellings() {
        assertEquals(leaf("city", Operator.NOT_EQUALS, "NYC"), parser.parse("city != 'NYC'"));
        assertEquals(leaf("city", Operator.NOT_EQUALS, "NYC"), parser.parse("city <> 'NYC'"));
    }

    @Test
    public void testNullTests() {
        assertEquals(leaf("email", Operator.IS_NULL, null), parser.parse("email IS NULL"));
        assertEquals(leaf("email", Operator.IS_NOT_NULL, null), parser.parse("email is not null"));
    }

    @Test
    public void testInList() {
        assertEquals(leaf("city", Operator.IN, Lists.immutable.with("NYC", "LA", 3L)),
            parser.parse("city IN ('NYC', 'LA', 3)"));
    }

    @Test
    public void testLike() {
        assertEquals(leaf("name", Operator.LIKE, "A%"), parser.parse("name LIKE 'A%'"));
    }

    @Test
    public void testQuotedLiteralKeepsKeywordsAndEscapedQuotes() {
        assertEquals(leaf("note", Operator.EQUALS, "this AND that"), parser.parse("note = 'this AND that'"));
        assertEquals(leaf("name", Operator.EQUALS, "O'Brien"), parser.parse("name = 'O''Brien'"));
    }

    // ============================================================
    // BETWEEN
    // ============================================================

    @Test
    public void testBetweenIsOneLeaf() {
        assertEquals(leaf("age", Operator.BETWEEN, new Predicate.Range(28L, 32L)),
            parser.parse("age BETWEEN 28 AND 32"));
    }

    @Test
    public void testBetweenFollowedByCombinator() {
        Predicate expected = new Predicate.Branch(
            leaf("age", Operator.BETWEEN, new Predicate.Range(28L, 32L)),
            Combinator.AND,
            leaf("city", Operator.EQUALS, "NYC"));
        assertEquals(expected, parser.parse("age BETWEEN 28 AND 32 AND city = 'NYC'"));
    }

    @Test
    public void testBetweenOnRightOfCombinator() {
        Predicate expected = new Predicate.Branch(
            leaf("city", Operator.EQUALS, "NYC"),
            Combinator.OR,
            leaf("age", Operator.BETWEEN, new Predicate.Range(1L, 2L)));
        assertEquals(expected, parser.parse("city = 'NYC' OR age BETWEEN 1 AND 2"));
    }

    // ============================================================
    // Precedence
    // ============================================================

    @Test
    public void testAndBindsTighterThanOrOnTheRight() {
        Predicate expected = new Predicate.Branch(
            leaf("a", Operator.EQUALS, 1L),
            Combinator.OR,
            new Predicate.Branch(leaf("b", Operator.EQUALS, 2L), Combinator.AND, leaf("c", Operator.EQUALS, 3L)));
        assertEquals(expected, parser.parse("a = 1 OR b = 2 AND c = 3"));
    }

    @Test
    public void testAndBindsTighterThanOrOnTheLeft() {
        Predicate expected = new Predicate.Branch(
            new Predicate.Branch(leaf("a", Operator.EQUALS, 1L), Combinator.AND, leaf("b", Operator.EQUALS, 2L)),
            Combinator.OR,
            leaf("c", Operator.EQUALS, 3L));
        assertEquals(expected, parser.parse("a = 1 AND b = 2 OR c = 3"));
    }

    @Test
    public void testChainsNestToTheRight() {
        Predicate expected = new Predicate.Branch(
            leaf("a", Operator.EQUALS, 1L),
            Combinator.AND,
            new Predicate.Branch(leaf("b", Operator.EQUALS, 2L), Combinator.AND, leaf("c", Operator.EQUALS, 3L)));
        assertEquals(expected, parser.parse("a = 1 and b = 2 and c = 3"));
    }

    @Test
    public void testParenthesesGroup() {
        Predicate expected = new Predicate.Branch(
            new Predicate.Branch(leaf("a", Operator.EQUALS, 1L), Combinator.OR, leaf("b", Operator.EQUALS, 2L)),
            Combinator.AND,
            leaf("c", Operator.EQUALS, 3L));
        assertEquals(expected, parser.parse("(a = 1 OR b = 2) AND c = 3"));
    }

    @Test
    public void testColumnsInFirstSeenOrder() {
        Predicate predicate = parser.parse("b = 1 AND a = 2 OR b = 3");
        assertEquals(Lists.immutable.with("b", "a"), predicate.columns());
    }

    // ============================================================
    // Errors
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   ",
        "age >",
        "age BETWEEN 1",
        "age BETWEEN 1 OR 2",
        "city IN ()",
        "city IN ('a'",
        "= 5",
        "(a = 1",
        "a = 1 b = 2",
        "a ! 1",
        "name = 'open",
        "a IS 5",
        "a = 1 AND",
        "AND = 1"
    })
    public void testMalformedClauseIsRejected(String clause) {
        assertThrows(PredicateSyntaxException.class, () -> parser.parse(clause));
    }

    @Test
    public void testErrorNamesTheOffendingCondition() {
        PredicateSyntaxException e = assertThrows(PredicateSyntaxException.class,
            () -> parser.parse("age > 25 AND salary LIKE"));
        assertEquals("salary LIKE", e.fragment());
    }

    @Test
    public void testErrorFragmentStopsAtNextCombinator() {
        PredicateSyntaxException e = assertThrows(PredicateSyntaxException.class,
            () -> parser.parse("age ?? 25 AND x = 1"));
        assertTrue(e.getMessage().contains("?"));

        e = assertThrows(PredicateSyntaxException.class, () -> parser.parse("age IS 25 AND x = 1"));
        assertEquals("age IS 25", e.fragment());
    }
}
