package com.challenges.stagedb.statement;

import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code INSERT INTO name [(cols)] VALUES (v, ...) [, (v, ...) ...]}.
 *
 * <p>With a column list every tuple must have one value per listed column. Without one the
 * arity is checked against the table schema at execution time.
 */
public class InsertParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("INSERT\\s+INTO\\b");
    private static final Pattern STATEMENT = Pattern.compile(
        "^INSERT\\s+INTO\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?\\s*VALUES\\s*(.+)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final String GRAMMAR =
        "INSERT INTO tablename [(columns)] VALUES (values) [, (values) ...]";

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid INSERT syntax: " + sql, GRAMMAR);
        }
        String table = matcher.group(1);
        ImmutableList<String> columns = matcher.group(2) == null
            ? Lists.immutable.empty()
            : parseColumnList(matcher.group(2));

        ImmutableList<String> tuples = SqlText.splitTuples(matcher.group(3));
        MutableList<ImmutableList<Object>> rows = Lists.mutable.empty();

        for (int i = 0; i < tuples.size(); i++) {
            ImmutableList<Object> values = parseValues(tuples.get(i));
            if (columns.notEmpty() && values.size() != columns.size()) {
                if (tuples.size() == 1) {
                    throw new StatementSyntaxException("Column count (" + columns.size()
                        + ") does not match value count (" + values.size() + ")");
                }
                throw new StatementSyntaxException("Row " + (i + 1) + " has wrong number of values: expected "
                    + columns.size() + ", got " + values.size());
            }
            rows.add(values);
        }

        return new StatementSpec.Insert(table, columns, rows.toImmutable());
    }

    private ImmutableList<String> parseColumnList(String list) {
        ImmutableList<String> columns = SqlText.splitTopLevel(list, ',');
        for (String column : columns) {
            if (!column.matches("\\w+")) {
                throw new StatementSyntaxException("Invalid column name '" + column + "' in column list", GRAMMAR);
            }
        }
        if (columns.distinct().size() != columns.size()) {
            throw new StatementSyntaxException("Column list names a column more than once: (" + list.trim() + ")");
        }
        return columns;
    }

    /**
     * Splits one tuple on commas outside quotes and infers each literal.
     */
    static ImmutableList<Object> parseValues(String tuple) {
        if (tuple.isBlank()) {
            throw new StatementSyntaxException("Empty VALUES tuple", GRAMMAR);
        }
        MutableList<Object> values = Lists.mutable.empty();
        for (String token : SqlText.splitTopLevel(tuple, ',')) {
            if (token.isEmpty()) {
                throw new StatementSyntaxException("Missing value in VALUES (" + tuple.trim() + ")");
            }
            values.add(Values.parseLiteral(token));
        }
        return values.toImmutable();
    }
}
