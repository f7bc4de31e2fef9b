package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.predicate.Predicate;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.RowStore;
import com.challenges.stagedb.storage.StoreException;
import com.challenges.stagedb.storage.Table;
import com.challenges.stagedb.storage.TableSchema;

/**
 * Base for stages that run one kind of statement against the row store and answer with a
 * terminal. Store failures become error terminals.
 *
 * @param <T> the statement kind handled
 */
public abstract class SpecExecuteStage<T extends StatementSpec> implements Stage {
    protected final RowStore store;
    private final Class<T> type;

    protected SpecExecuteStage(RowStore store, Class<T> type) {
        this.store = store;
        this.type = type;
    }

    /**
     * @throws StoreException if the statement cannot be applied; the store is left unchanged
     */
    protected abstract Payload.Terminal execute(T spec);

    @Override
    public boolean appliesTo(WorkUnit unit) {
        return type.isInstance(unit.payload());
    }

    @Override
    public void transform(WorkUnit unit, StageContext context) {
        try {
            context.emit(execute(unit.payloadAs(type)));
        } catch (StoreException e) {
            context.emit(Payload.Terminal.error(e.getMessage()));
        }
    }

    protected Table requireTable(String name) {
        return store.getTable(name).orElseThrow(() -> StoreException.forTableNotFound(name));
    }

    protected static void requireColumns(TableSchema schema, Iterable<String> columns) {
        for (String column : columns) {
            if (!schema.hasColumn(column)) {
                throw StoreException.forColumnNotFound(column, schema.name());
            }
        }
    }

    protected static void requireColumns(TableSchema schema, Predicate where) {
        if (where != null) {
            requireColumns(schema, where.columns());
        }
    }
}
