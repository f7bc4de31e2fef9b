package com.challenges.stagedb.output;

import com.challenges.stagedb.storage.Row;
import com.challenges.stagedb.storage.Values;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;

/**
 * Renders a row set as text.
 *
 * <p>{@link Style#TAB} prints the row count, a blank line, a tab-separated header, a dashed
 * rule and one tab-separated line per row. {@link Style#BOX} draws a bordered table with
 * padded columns. Nulls render as {@code NULL}. An empty set is just {@code 0 rows returned}.
 */
public class ResultFormatter {

    public enum Style {
        TAB,
        BOX
    }

    private final Style style;

    public ResultFormatter() {
        this(Style.TAB);
    }

    public ResultFormatter(Style style) {
        this.style = style;
    }

    public String format(ListIterable<String> columns, ListIterable<Row> rows) {
        if (rows.isEmpty()) {
            return countLine(0);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(countLine(rows.size())).append("\n\n");

        if (style == Style.BOX) {
            formatBox(columns, rows, sb);
        } else {
            formatTabs(columns, rows, sb);
        }

        return sb.toString();
    }

    private void formatTabs(ListIterable<String> columns, ListIterable<Row> rows, StringBuilder sb) {
        String header = columns.makeString("\t");
        sb.append(header).append('\n');
        sb.append("-".repeat(header.length() + columns.size() * 3));

        for (Row row : rows) {
            sb.append('\n');
            sb.append(columns.collect(column -> Values.render(row.get(column))).makeString("\t"));
        }
    }

    private void formatBox(ListIterable<String> columns, ListIterable<Row> rows, StringBuilder sb) {
        MutableList<Integer> widths = columns.toList().collect(column ->
            Math.max(column.length(), rows.collect(row -> Values.render(row.get(column)).length()).max()));

        appendDivider(widths, sb);
        appendCells(columns.toList(), widths, sb);
        appendDivider(widths, sb);
        for (Row row : rows) {
            appendCells(columns.toList().collect(column -> Values.render(row.get(column))), widths, sb);
        }
        appendDivider(widths, sb);
        sb.setLength(sb.length() - 1);
    }

    private static void appendDivider(ListIterable<Integer> widths, StringBuilder sb) {
        sb.append('+');
        widths.forEach(width -> sb.append("-".repeat(width + 2)).append('+'));
        sb.append('\n');
    }

    private static void appendCells(ListIterable<String> cells, ListIterable<Integer> widths, StringBuilder sb) {
        sb.append('|');
        for (int i = 0; i < cells.size(); i++) {
            String cell = cells.get(i);
            sb.append(' ').append(cell).append(" ".repeat(widths.get(i) - cell.length())).append(" |");
        }
        sb.append('\n');
    }

    private static String countLine(int count) {
        return count + (count == 1 ? " row" : " rows") + " returned";
    }
}
