package com.challenges.stagedb.statement;

import com.challenges.stagedb.storage.ColumnDefinition;
import com.challenges.stagedb.storage.ColumnType;
import com.challenges.stagedb.storage.TableSchema;
import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code CREATE TABLE [IF NOT EXISTS] name (col [TYPE] [PRIMARY KEY] [NOT NULL]
 * [DEFAULT v], ...)}. Columns without a type are TEXT.
 */
public class CreateTableParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("CREATE\\s+TABLE\\b");
    private static final Pattern STATEMENT = Pattern.compile(
        "^CREATE\\s+TABLE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)\\s*\\((.*)\\)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final String GRAMMAR =
        "CREATE TABLE [IF NOT EXISTS] name (column [TYPE] [PRIMARY KEY] [NOT NULL] [DEFAULT value], ...)";

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid CREATE TABLE syntax: " + sql, GRAMMAR);
        }
        boolean ifNotExists = matcher.group(1) != null;
        String tableName = matcher.group(2);

        MutableList<ColumnDefinition> columns = Lists.mutable.empty();
        for (String definition : SqlText.splitTopLevel(matcher.group(3), ',')) {
            if (definition.isEmpty()) {
                continue;
            }
            ColumnDefinition column = parseColumn(SqlText.splitWords(definition));
            if (columns.anySatisfy(existing -> existing.name().equals(column.name()))) {
                throw new StatementSyntaxException("Column '" + column.name() + "' is declared more than once");
            }
            if (column.primaryKey() && columns.anySatisfy(ColumnDefinition::primaryKey)) {
                throw new StatementSyntaxException("Table can have only one PRIMARY KEY");
            }
            columns.add(column);
        }

        if (columns.isEmpty()) {
            throw new StatementSyntaxException("Table must have at least one column", GRAMMAR);
        }
        return new StatementSpec.CreateTable(new TableSchema(tableName, columns.toImmutable()), ifNotExists);
    }

    private ColumnDefinition parseColumn(ImmutableList<String> tokens) {
        String name = tokens.get(0);
        if (!name.matches("\\w+")) {
            throw new StatementSyntaxException("Invalid column name '" + name + "'", GRAMMAR);
        }
        ColumnDefinition column = ColumnDefinition.of(name, ColumnType.TEXT);
        boolean typeSet = false;

        int i = 1;
        while (i < tokens.size()) {
            String token = tokens.get(i).toUpperCase(Locale.ROOT);
            Optional<ColumnType> type = ColumnType.fromKeyword(token);

            if (type.isPresent()) {
                if (typeSet) {
                    throw new StatementSyntaxException("Multiple types specified for column '" + name + "'");
                }
                column = column.withType(type.get());
                typeSet = true;
                i++;
            } else if (token.equals("PRIMARY")) {
                expectNext(tokens, i, "KEY", name);
                column = column.withPrimaryKey();
                i += 2;
            } else if (token.equals("NOT")) {
                expectNext(tokens, i, "NULL", name);
                column = column.withNotNull();
                i += 2;
            } else if (token.equals("DEFAULT")) {
                if (i + 1 >= tokens.size()) {
                    throw new StatementSyntaxException("Expected value after DEFAULT in column '" + name + "'");
                }
                column = column.withDefault(Values.parseLiteral(tokens.get(i + 1)));
                i += 2;
            } else {
                throw new StatementSyntaxException("Unknown keyword '" + tokens.get(i) + "' in column '" + name + "'");
            }
        }
        return column;
    }

    private static void expectNext(ImmutableList<String> tokens, int index, String expected, String column) {
        if (index + 1 >= tokens.size() || !tokens.get(index + 1).equalsIgnoreCase(expected)) {
            throw new StatementSyntaxException(
                "Expected " + expected + " after " + tokens.get(index).toUpperCase(Locale.ROOT) + " in column '" + column + "'");
        }
    }
}
