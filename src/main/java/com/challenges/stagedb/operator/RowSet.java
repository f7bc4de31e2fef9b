package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Objects;

/**
 * Rows in flight for one SELECT, with the columns to show, the originating select (so
 * operators can read its ORDER BY, LIMIT and DISTINCT settings) and the phase reached.
 */
public record RowSet(ImmutableList<Row> rows,
                     ImmutableList<String> columns,
                     StatementSpec.Select select,
                     Phase phase) implements Payload {

    public RowSet {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(select, "select");
        Objects.requireNonNull(phase, "phase");
    }

    public RowSet advance(Phase next, ImmutableList<Row> nextRows) {
        return new RowSet(nextRows, columns, select, next);
    }

    @Override
    public String describe() {
        return rows.size() + " row(s) " + phase.name().toLowerCase() + " for " + select.table();
    }
}
