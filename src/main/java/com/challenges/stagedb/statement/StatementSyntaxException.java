package com.challenges.stagedb.statement;

/**
 * A statement that does not fit its grammar. The message names the offending fragment and,
 * where useful, the expected form.
 */
public class StatementSyntaxException extends IllegalArgumentException {

    public StatementSyntaxException(String message) {
        super(message);
    }

    public StatementSyntaxException(String message, String expected) {
        super(message + "\nExpected: " + expected);
    }
}
