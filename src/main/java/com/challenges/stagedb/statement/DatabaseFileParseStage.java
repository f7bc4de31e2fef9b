package com.challenges.stagedb.statement;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code SAVE DATABASE 'path'} and {@code LOAD DATABASE 'path'}.
 */
public class DatabaseFileParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("(SAVE|LOAD)\\s+DATABASE\\b");
    private static final Pattern STATEMENT = keyword("^(SAVE|LOAD)\\s+DATABASE\\s+(['\"])(.+?)\\2$");

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            String verb = sql.substring(0, 4).toUpperCase(Locale.ROOT);
            throw new StatementSyntaxException("Invalid " + verb + " DATABASE syntax", verb + " DATABASE 'filename'");
        }
        String path = matcher.group(3);
        return matcher.group(1).equalsIgnoreCase("SAVE")
            ? new StatementSpec.SaveDatabase(path)
            : new StatementSpec.LoadDatabase(path);
    }
}
