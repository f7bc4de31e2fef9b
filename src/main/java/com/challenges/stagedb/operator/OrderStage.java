package com.challenges.stagedb.operator;

import com.challenges.stagedb.predicate.ValueComparator;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.Comparator;

/**
 * Stable sort on the ORDER BY column. Nulls go last in both directions; numeric values
 * compare numerically, everything else as text.
 */
public class OrderStage extends RowSetOperatorStage {

    @Override
    protected Phase phase() {
        return Phase.SORTED;
    }

    @Override
    protected boolean requiredBy(StatementSpec.Select select) {
        return select.orderBy() != null;
    }

    @Override
    protected ImmutableList<Row> apply(RowSet rowSet) {
        return rowSet.rows().toSortedList(comparator(rowSet.select().orderBy())).toImmutable();
    }

    static Comparator<Row> comparator(StatementSpec.OrderBy orderBy) {
        Comparator<Object> values = orderBy.direction() == StatementSpec.Direction.DESC
            ? ValueComparator.INSTANCE.reversed()
            : ValueComparator.INSTANCE;
        return Comparator.comparing((Row row) -> row.get(orderBy.column()), Comparator.nullsLast(values));
    }
}
