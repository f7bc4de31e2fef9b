package com.challenges.stagedb.predicate;

/**
 * Comparison operators a {@link Predicate.Leaf} may carry.
 */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    IN("IN"),
    LIKE("LIKE"),
    BETWEEN("BETWEEN"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean takesOperand() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    /**
     * Maps a comparison token to its operator; {@code <>} is an alias of {@code !=}.
     */
    public static Operator fromComparison(String token) {
        return switch (token) {
            case "=" -> EQUALS;
            case "!=", "<>" -> NOT_EQUALS;
            case "<" -> LESS_THAN;
            case ">" -> GREATER_THAN;
            case "<=" -> LESS_EQUAL;
            case ">=" -> GREATER_EQUAL;
            default -> throw new IllegalArgumentException("Not a comparison operator: " + token);
        };
    }
}
