package com.challenges.stagedb.predicate;

/**
 * A WHERE clause that could not be parsed. Carries the offending part of the clause.
 */
public class PredicateSyntaxException extends IllegalArgumentException {
    private final String fragment;

    public PredicateSyntaxException(String message, String fragment) {
        super(message + ": " + fragment);
        this.fragment = fragment;
    }

    public String fragment() {
        return fragment;
    }
}
