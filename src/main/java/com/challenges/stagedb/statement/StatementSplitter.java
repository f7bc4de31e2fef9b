package com.challenges.stagedb.statement;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Splits a script into statements on semicolons outside quoted literals. Blank
 * statements are dropped.
 */
public final class StatementSplitter {

    private StatementSplitter() {
    }

    public static ImmutableList<String> split(String script) {
        return SqlText.splitTopLevel(script, ';').reject(String::isEmpty);
    }
}
