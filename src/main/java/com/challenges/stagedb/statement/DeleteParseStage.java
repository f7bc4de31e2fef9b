package com.challenges.stagedb.statement;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code DELETE FROM name [WHERE clause]}. Without WHERE every row goes.
 */
public class DeleteParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("DELETE\\b");
    private static final Pattern STATEMENT = Pattern.compile(
        "^DELETE\\s+FROM\\s+(\\w+)(?:\\s+WHERE\\s+(.+))?$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid DELETE syntax: " + sql, "DELETE FROM tablename [WHERE condition]");
        }
        String clause = matcher.group(2);
        return new StatementSpec.Delete(matcher.group(1), clause == null ? null : parseWhere(clause));
    }
}
