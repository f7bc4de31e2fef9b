package com.challenges.stagedb.statement;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code SELECT [DISTINCT] cols|* FROM name [WHERE clause] [ORDER BY col [ASC|DESC]]
 * [LIMIT n [OFFSET m]]}. Clause keywords inside quoted literals are ignored.
 */
public class SelectParseStage extends StatementParseStage {
    private static final Pattern PREFIX = keyword("SELECT\\b");
    private static final Pattern STATEMENT = Pattern.compile(
        "^SELECT\\s+(DISTINCT\\s+)?(.+?)\\s+FROM\\s+(\\w+)(.*)$",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern WHERE = keyword("\\bWHERE\\b");
    private static final Pattern ORDER_BY = keyword("\\bORDER\\s+BY\\b");
    private static final Pattern LIMIT = keyword("\\bLIMIT\\b");
    private static final Pattern ORDER_CLAUSE = keyword("^ORDER\\s+BY\\s+(\\w+)(?:\\s+(ASC|DESC))?$");
    private static final Pattern LIMIT_CLAUSE = keyword("^LIMIT\\s+(\\d+)(?:\\s+OFFSET\\s+(\\d+))?$");
    private static final String GRAMMAR =
        "SELECT [DISTINCT] columns FROM tablename [WHERE condition] [ORDER BY column [ASC|DESC]] [LIMIT n [OFFSET m]]";

    @Override
    protected Pattern prefix() {
        return PREFIX;
    }

    @Override
    protected StatementSpec parse(String sql) {
        Matcher matcher = STATEMENT.matcher(sql);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid SELECT syntax: " + sql, GRAMMAR);
        }
        boolean distinct = matcher.group(1) != null;
        ImmutableList<String> columns = parseColumns(matcher.group(2).trim());
        String table = matcher.group(3);
        String remainder = matcher.group(4);

        int whereAt = SqlText.indexOfKeyword(remainder, WHERE);
        int orderAt = SqlText.indexOfKeyword(remainder, ORDER_BY);
        int limitAt = SqlText.indexOfKeyword(remainder, LIMIT);
        checkClauseOrder(whereAt, orderAt, limitAt);

        int firstClause = firstNonNegative(whereAt, orderAt, limitAt, remainder.length());
        if (!remainder.substring(0, firstClause).isBlank()) {
            throw new StatementSyntaxException("Unexpected text after table name: " + remainder.substring(0, firstClause).trim(), GRAMMAR);
        }

        StatementSpec.Select select = new StatementSpec.Select(table, columns, null, null, null, null, distinct);

        if (whereAt >= 0) {
            int end = firstNonNegative(orderAt, limitAt, -1, remainder.length());
            String clause = remainder.substring(whereAt + "WHERE".length(), end).trim();
            select = withWhere(select, clause);
        }
        if (orderAt >= 0) {
            int end = limitAt >= 0 ? limitAt : remainder.length();
            select = withOrderBy(select, remainder.substring(orderAt, end).trim());
        }
        if (limitAt >= 0) {
            select = withLimit(select, remainder.substring(limitAt).trim());
        }
        return select;
    }

    private ImmutableList<String> parseColumns(String list) {
        if (list.equals("*")) {
            return Lists.immutable.empty();
        }
        ImmutableList<String> columns = SqlText.splitTopLevel(list, ',');
        for (String column : columns) {
            if (!column.matches("\\w+")) {
                throw new StatementSyntaxException("Invalid column '" + column + "' in SELECT list", GRAMMAR);
            }
        }
        return columns;
    }

    private StatementSpec.Select withWhere(StatementSpec.Select select, String clause) {
        return new StatementSpec.Select(select.table(), select.columns(), parseWhere(clause),
            select.orderBy(), select.limit(), select.offset(), select.distinct());
    }

    private StatementSpec.Select withOrderBy(StatementSpec.Select select, String clause) {
        Matcher matcher = ORDER_CLAUSE.matcher(clause);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid ORDER BY clause: " + clause, "ORDER BY column [ASC|DESC]");
        }
        StatementSpec.Direction direction = matcher.group(2) == null
            ? StatementSpec.Direction.ASC
            : StatementSpec.Direction.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
        return new StatementSpec.Select(select.table(), select.columns(), select.where(),
            new StatementSpec.OrderBy(matcher.group(1), direction), select.limit(), select.offset(), select.distinct());
    }

    private StatementSpec.Select withLimit(StatementSpec.Select select, String clause) {
        Matcher matcher = LIMIT_CLAUSE.matcher(clause);
        if (!matcher.matches()) {
            throw new StatementSyntaxException("Invalid LIMIT clause: " + clause, "LIMIT n [OFFSET m]");
        }
        Integer limit = parseCount(matcher.group(1), clause);
        Integer offset = matcher.group(2) == null ? null : parseCount(matcher.group(2), clause);
        return new StatementSpec.Select(select.table(), select.columns(), select.where(),
            select.orderBy(), limit, offset, select.distinct());
    }

    private static Integer parseCount(String digits, String clause) {
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            throw new StatementSyntaxException("Number out of range in: " + clause);
        }
    }

    private static void checkClauseOrder(int whereAt, int orderAt, int limitAt) {
        if ((whereAt >= 0 && orderAt >= 0 && orderAt < whereAt)
            || (whereAt >= 0 && limitAt >= 0 && limitAt < whereAt)
            || (orderAt >= 0 && limitAt >= 0 && limitAt < orderAt)) {
            throw new StatementSyntaxException("Clauses out of order", GRAMMAR);
        }
    }

    private static int firstNonNegative(int a, int b, int c, int fallback) {
        int first = fallback;
        for (int candidate : new int[] {a, b, c}) {
            if (candidate >= 0 && candidate < first) {
                first = candidate;
            }
        }
        return first;
    }
}
