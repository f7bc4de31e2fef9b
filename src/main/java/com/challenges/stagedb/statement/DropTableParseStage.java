package com.challenges.stagedb.statement;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code DROP TABLE [IF EXISTS] name}.
 */
public class DropTableParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("DROP\\s+TABLE\\b");
    private static final Pattern STATEMENT = keyword("^DROP\\s+TABLE\\s+(IF\\s+EXISTS\\s+)?(\\w+)$");

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid DROP TABLE syntax: " + sql, "DROP TABLE [IF EXISTS] name");
        }
        return new StatementSpec.DropTable(matcher.group(2), matcher.group(1) != null);
    }
}
