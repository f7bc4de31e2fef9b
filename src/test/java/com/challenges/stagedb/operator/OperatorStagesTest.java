package com.challenges.stagedb.operator;

import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.predicate.PredicateEvaluator;
import com.challenges.stagedb.predicate.PredicateParser;
import com.challenges.stagedb.statement.StatementSpec;
import com.challenges.stagedb.storage.Row;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorStagesTest {

    // ============================================================
    // Test Infrastructure
    // ============================================================

    private static Row row(Object id, Object name, Object score) {
        MutableMap<String, Object> values = Maps.mutable.empty();
        values.put("id", id);
        values.put("name", name);
        values.put("score", score);
        return Row.of(values);
    }

    private static final ImmutableList<Row> ROWS = Lists.immutable.with(
        row(1L, "b", 10L),
        row(2L, "a", null),
        row(3L, "c", 9.5),
        row(4L, "a", 10L),
        row(5L, "d", 2L));

    private static StatementSpec.Select select(StatementSpec.OrderBy orderBy, Integer limit, Integer offset, boolean distinct,
                                               String... columns) {
        return new StatementSpec.Select("t", Lists.immutable.with(columns), null, orderBy, limit, offset, distinct);
    }

    private static RowSet scanned(StatementSpec.Select select) {
        ImmutableList<String> columns = select.selectAll() ? Lists.immutable.with("id", "name", "score") : select.columns();
        return new RowSet(ROWS, columns, select, Phase.SCANNED);
    }

    private static ImmutableList<Object> column(ImmutableList<Row> rows, String column) {
        return rows.collect(row -> row.get(column));
    }

    // ============================================================
    // Order
    // ============================================================

    @Test
    public void testAscendingPutsNullsLastAndComparesNumerically() {
        StatementSpec.Select select = select(new StatementSpec.OrderBy("score", StatementSpec.Direction.ASC), null, null, false);
        ImmutableList<Row> sorted = new OrderStage().apply(scanned(select));
        assertEquals(Lists.immutable.with(5L, 3L, 1L, 4L, 2L), column(sorted, "id"));
    }

    @Test
    public void testDescendingKeepsNullsLastAndIsStable() {
        StatementSpec.Select select = select(new StatementSpec.OrderBy("score", StatementSpec.Direction.DESC), null, null, false);
        ImmutableList<Row> sorted = new OrderStage().apply(scanned(select));
        assertEquals(Lists.immutable.with(1L, 4L, 3L, 5L, 2L), column(sorted, "id"));
    }

    @Test
    public void testTextOrdering() {
        StatementSpec.Select select = select(new StatementSpec.OrderBy("name", StatementSpec.Direction.ASC), null, null, false);
        ImmutableList<Row> sorted = new OrderStage().apply(scanned(select));
        assertEquals(Lists.immutable.with(2L, 4L, 1L, 3L, 5L), column(sorted, "id"));
    }

    // ============================================================
    // Limit / Distinct / Project / Filter
    // ============================================================

    @Test
    public void testLimitAndOffset() {
        assertEquals(Lists.immutable.with(2L, 3L),
            column(new LimitStage().apply(scanned(select(null, 2, 1, false))), "id"));
        assertEquals(Lists.immutable.with(4L, 5L),
            column(new LimitStage().apply(scanned(select(null, null, 3, false))), "id"));
        assertEquals(Lists.immutable.with(1L, 2L),
            column(new LimitStage().apply(scanned(select(null, 2, null, false))), "id"));
        assertTrue(new LimitStage().apply(scanned(select(null, 5, 10, false))).isEmpty());
        assertTrue(new LimitStage().apply(scanned(select(null, 0, null, false))).isEmpty());
    }

    @Test
    public void testDistinctKeepsFirstOfEachSignature() {
        RowSet projected = scanned(select(null, null, null, true, "name"));
        ImmutableList<Row> unique = new DistinctStage().apply(projected);
        assertEquals(Lists.immutable.with(1L, 2L, 3L, 5L), column(unique, "id"));
    }

    @Test
    public void testProjectKeepsRequestedColumnsInOrder() {
        ImmutableList<Row> projected = new ProjectStage().apply(scanned(select(null, null, null, false, "score", "id")));
        assertFalse(projected.getFirst().has("name"));
        assertEquals(10L, projected.getFirst().get("score"));
    }

    @Test
    public void testFilter() {
        StatementSpec.Select select = new StatementSpec.Select("t", Lists.immutable.empty(),
            new PredicateParser().parse("score >= 10 OR name = 'd'"), null, null, null, false);
        ImmutableList<Row> kept = new FilterStage(new PredicateEvaluator()).apply(scanned(select));
        assertEquals(Lists.immutable.with(1L, 4L, 5L), column(kept, "id"));
    }

    // ============================================================
    // Phase gating
    // ============================================================

    @Test
    public void testOperatorAppliesOnlyBeforeItsPhaseAndWhenAskedFor() {
        StatementSpec.Select ordered = select(new StatementSpec.OrderBy("id", StatementSpec.Direction.ASC), null, null, false);
        OrderStage order = new OrderStage();

        assertTrue(order.appliesTo(WorkUnit.of(scanned(ordered), "run")));
        assertTrue(order.appliesTo(WorkUnit.of(scanned(ordered).advance(Phase.FILTERED, ROWS), "run")));
        assertFalse(order.appliesTo(WorkUnit.of(scanned(ordered).advance(Phase.SORTED, ROWS), "run")));
        assertFalse(order.appliesTo(WorkUnit.of(scanned(select(null, null, null, false)), "run")));
        assertFalse(order.appliesTo(WorkUnit.of(new Payload.Statement("x"), "run")));
    }
}
