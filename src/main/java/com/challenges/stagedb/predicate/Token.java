package com.challenges.stagedb.predicate;

import java.util.Locale;

/**
 * A lexical unit of a WHERE clause. {@code start} and {@code end} are offsets into the
 * clause text.
 */
public record Token(Kind kind, String text, int start, int end) {

    public enum Kind {
        WORD,
        NUMBER,
        STRING,
        COMPARISON,
        LEFT_PAREN,
        RIGHT_PAREN,
        COMMA
    }

    public boolean isKeyword(String keyword) {
        return kind == Kind.WORD && text.toUpperCase(Locale.ROOT).equals(keyword);
    }
}
