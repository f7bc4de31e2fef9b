package com.challenges.stagedb.operator;

import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Keeps the first row of each distinct combination of the shown column values.
 */
public class DistinctStage extends RowSetOperatorStage {

    @Override
    protected Phase phase() {
        return Phase.DISTINCT;
    }

    @Override
    protected boolean requiredBy(StatementSpec.Select select) {
        return select.distinct();
    }

    @Override
    protected ImmutableList<Row> apply(RowSet rowSet) {
        MutableSet<ImmutableList<Object>> seen = Sets.mutable.empty();
        MutableList<Row> unique = Lists.mutable.empty();
        for (Row row : rowSet.rows()) {
            ImmutableList<Object> signature = rowSet.columns().collect(row::get);
            if (seen.add(signature)) {
                unique.add(row);
            }
        }
        return unique.toImmutable();
    }
}
