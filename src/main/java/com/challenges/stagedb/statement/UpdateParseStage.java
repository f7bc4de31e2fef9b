package com.challenges.stagedb.statement;

import com.challenges.stagedb.predicate.Predicate;
import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code UPDATE name SET col = v [, ...] [WHERE clause]}.
 */
public class UpdateParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("UPDATE\\b");
    private static final Pattern STATEMENT = Pattern.compile(
        "^UPDATE\\s+(\\w+)\\s+SET\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern WHERE = keyword("\\bWHERE\\b");
    private static final Pattern ASSIGNMENT = Pattern.compile("^(\\w+)\\s*=\\s*(.+)$", Pattern.DOTALL);
    private static final String GRAMMAR = "UPDATE tablename SET column = value [, ...] [WHERE condition]";

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid UPDATE syntax: " + sql, GRAMMAR);
        }
        String table = matcher.group(1);
        String rest = matcher.group(2);

        String setClause = rest;
        Predicate where = null;
        int whereAt = SqlText.indexOfKeyword(rest, WHERE);
        if (whereAt >= 0) {
            setClause = rest.substring(0, whereAt);
            where = parseWhere(rest.substring(whereAt + "WHERE".length()).trim());
        }

        MutableList<StatementSpec.Assignment> assignments = Lists.mutable.empty();
        for (String part : SqlText.splitTopLevel(setClause, ',')) {
            Matcher assignment = ASSIGNMENT.matcher(part);
            if (!assignment.matches()) {
                throw new StatementSyntaxException("Invalid SET clause: " + part, "column = value");
            }
            String column = assignment.group(1);
            if (assignments.anySatisfy(existing -> existing.column().equals(column))) {
                throw new StatementSyntaxException("Column '" + column + "' is assigned more than once");
            }
            assignments.add(new StatementSpec.Assignment(column, Values.parseLiteral(assignment.group(2))));
        }

        return new StatementSpec.Update(table, assignments.toImmutable(), where);
    }
}
