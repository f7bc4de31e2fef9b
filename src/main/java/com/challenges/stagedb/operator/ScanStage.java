package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.StoreException;
import com.challenges.stagedb.storage.Table;
import com.challenges.stagedb.storage.TableSchema;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Starts a SELECT: resolves the table, checks every referenced column and emits the
 * table's rows as a {@link Phase#SCANNED} row set.
 */
public class ScanStage implements Stage {
    private final RowStore store;

    public ScanStage(RowStore store) {
        this.store = store;
    }

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return unit.payload() instanceof StatementSpec.Select;
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        StatementSpec.Select select = unit.payloadAs(StatementSpec.Select.class);
        try {
            Table table = store.getTable(select.table())
                .orElseThrow(() -> StoreException.forTableNotFound(select.table()));
            TableSchema schema = table.schema();
            referencedColumns(select).forEach(column -> {
                if (!schema.hasColumn(column)) {
                    throw StoreException.forColumnNotFound(column, schema.name());
                }
            });
            ImmutableList<String> columns = select.selectAll() ? schema.columnNames() : select.columns();
            context.emit(new RowSet(table.rows(), columns, select, Phase.SCANNED));
        } catch (StoreException e) {
            context.emit(Payload.Terminal.error(e.getMessage()));
        }
    }

    private static ImmutableList<String> referencedColumns(StatementSpec.Select select) {
        MutableList<String> columns = Lists.mutable.ofAll(select.columns());
        if (select.where() != null) {
            columns.addAllIterable(select.where().columns());
        }
        if (select.orderBy() != null) {
            columns.add(select.orderBy().column());
        }
        return columns.distinct().toImmutable();
    }
}
