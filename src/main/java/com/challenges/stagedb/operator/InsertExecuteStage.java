package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.ColumnDefinition;
import com.challenges.stagedb.storage.Row;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.StoreException;
import com.challenges.stagedb.storage.TableSchema;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Builds rows in schema column order and inserts them as one batch. With a column list,
 * unlisted columns take their default or null; without one, every tuple must supply a
 * value for every column.
 */
public class InsertExecuteStage extends SpecExecuteStage<StatementSpec.Insert> {

    public InsertExecuteStage(RowStore store) {
        super(store, StatementSpec.Insert.class);
    }

    @Override
    protected Payload.Terminal execute(StatementSpec.Insert spec) {
        TableSchema schema = requireTable(spec.table()).schema();
        if (spec.hasColumnList()) {
            requireColumns(schema, spec.columns());
        }
        ImmutableList<Row> rows = spec.rows().collect(values -> toRow(schema, spec, values));
        store.insertRows(spec.table(), rows);
        return Payload.Terminal.success(rows.size() + " row(s) inserted into '" + spec.table() + "'");
    }

    private static Row toRow(TableSchema schema, StatementSpec.Insert spec, ImmutableList<Object> values) {
        MutableMap<String, Object> row = Maps.mutable.empty();
        if (!spec.hasColumnList()) {
            if (values.size() != schema.columnCount()) {
                throw new StoreException("Column count mismatch. Table '" + schema.name() + "' has "
                        + schema.columnCount() + " columns, but INSERT provides " + values.size() + " values");
            }
            schema.columns().forEachWithIndex((column, i) -> row.put(column.name(), values.get(i)));
            return Row.of(row);
        }
        for (ColumnDefinition column : schema.columns()) {
            int position = spec.columns().indexOf(column.name());
            row.put(column.name(), position >= 0 ? values.get(position) : column.defaultValue());
        }
        return Row.of(row);
    }
}
