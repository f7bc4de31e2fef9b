package com.challenges.stagedb.statement;

import com.challenges.stagedb.pipeline.DispatchResult;
import com.challenges.stagedb.pipeline.Dispatcher;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.Stage;
import com.challenges.stagedb.pipeline.StageContext;
import com.challenges.stagedb.pipeline.WorkUnit;
import com.challenges.stagedb.predicate.Operator;
import com.challenges.stagedb.predicate.Predicate;
import com.challenges.stagedb.storage.ColumnDefinition;
import com.challenges.stagedb.storage.ColumnType;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParseStagesTest {

    // ============================================================
    // CREATE TABLE / DROP TABLE
    // ============================================================

    @Test
    public void testCreateTableWithConstraints() {
        StatementSpec.CreateTable create = (StatementSpec.CreateTable) new CreateTableParseStage().parse(
            "CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT NOT NULL, city DEFAULT 'NYC', score REAL)");

        assertFalse(create.ifNotExists());
        assertEquals("users", create.schema().name());
        assertEquals(Lists.immutable.with("id", "name", "city", "score"), create.schema().columnNames());

        ColumnDefinition id = create.schema().column("id").orElseThrow();
        assertTrue(id.primaryKey());
        assertTrue(id.notNull());
        assertEquals(ColumnType.INTEGER, id.type());

        assertTrue(create.schema().column("name").orElseThrow().notNull());
        ColumnDefinition city = create.schema().column("city").orElseThrow();
        assertEquals(ColumnType.TEXT, city.type());
        assertEquals("NYC", city.defaultValue());
        assertEquals(ColumnType.REAL, create.schema().column("score").orElseThrow().type());
    }

    @Test
    public void testCreateTableIfNotExists() {
        StatementSpec.CreateTable create = (StatementSpec.CreateTable) new CreateTableParseStage().parse(
            "create table if not exists t (a)");
        assertTrue(create.ifNotExists());
        assertEquals("t", create.schema().name());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "CREATE TABLE t (a INTEGER TEXT)",
        "CREATE TABLE t (a PRIMARY, b)",
        "CREATE TABLE t (a NOT)",
        "CREATE TABLE t (a DEFAULT)",
        "CREATE TABLE t (a UNIQUE)",
        "CREATE TABLE t (a, a)",
        "CREATE TABLE t (a PRIMARY KEY, b PRIMARY KEY)",
        "CREATE TABLE t ()",
        "CREATE TABLE t"
    })
    public void testCreateTableErrors(String sql) {
        assertThrows(StatementSyntaxException.class, () -> new CreateTableParseStage().parse(sql));
    }

    @Test
    public void testDropTable() {
        assertEquals(new StatementSpec.DropTable("users", true),
            new DropTableParseStage().parse("DROP TABLE IF EXISTS users"));
        assertEquals(new StatementSpec.DropTable("users", false),
            new DropTableParseStage().parse("drop table users"));
        assertThrows(StatementSyntaxException.class, () -> new DropTableParseStage().parse("DROP TABLE"));
    }

    // ============================================================
    // INSERT
    // ============================================================

    @Test
    public void testInsertPositional() {
        StatementSpec.Insert insert = (StatementSpec.Insert) new InsertParseStage().parse(
            "INSERT INTO users VALUES (1, 'Alice, Jr.', 3.5, NULL, 'it''s')");

        assertFalse(insert.hasColumnList());
        assertEquals(1, insert.rows().size());
        assertEquals(Lists.mutable.with(1L, "Alice, Jr.", 3.5, null, "it's"), insert.rows().getFirst());
    }

    @Test
    public void testInsertBatchWithColumnList() {
        StatementSpec.Insert insert = (StatementSpec.Insert) new InsertParseStage().parse(
            "INSERT INTO users (id, name) VALUES (1, 'a'), (2, 'b) , (c'),(3,'d')");

        assertEquals(Lists.immutable.with("id", "name"), insert.columns());
        assertEquals(3, insert.rows().size());
        assertEquals("b) , (c", insert.rows().get(1).get(1));
        assertEquals(3L, insert.rows().get(2).get(0));
    }

    @Test
    public void testInsertArityMismatch() {
        StatementSyntaxException single = assertThrows(StatementSyntaxException.class,
            () -> new InsertParseStage().parse("INSERT INTO t (a, b) VALUES (1)"));
        assertEquals("Column count (2) does not match value count (1)", single.getMessage());

        StatementSyntaxException batch = assertThrows(StatementSyntaxException.class,
            () -> new InsertParseStage().parse("INSERT INTO t (a, b) VALUES (1, 2), (3)"));
        assertEquals("Row 2 has wrong number of values: expected 2, got 1", batch.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "INSERT INTO t VALUES",
        "INSERT INTO t VALUES 1, 2",
        "INSERT INTO t VALUES (1, 2",
        "INSERT INTO t VALUES (1) (2)",
        "INSERT INTO t VALUES (1),",
        "INSERT INTO t VALUES ()",
        "INSERT INTO t VALUES (1, , 2)",
        "INSERT INTO t (a, a) VALUES (1, 2)"
    })
    public void testInsertErrors(String sql) {
        assertThrows(StatementSyntaxException.class, () -> new InsertParseStage().parse(sql));
    }

    // ============================================================
    // SELECT
    // ============================================================

    @Test
    public void testSelectAllClauses() {
        StatementSpec.Select select = (StatementSpec.Select) new SelectParseStage().parse(
            "SELECT DISTINCT name, city FROM users WHERE age > 25 ORDER BY age DESC LIMIT 10 OFFSET 5");

        assertTrue(select.distinct());
        assertEquals(Lists.immutable.with("name", "city"), select.columns());
        assertEquals("users", select.table());
        assertEquals(new Predicate.Leaf("age", Operator.GREATER_THAN, 25L), select.where());
        assertEquals(new StatementSpec.OrderBy("age", StatementSpec.Direction.DESC), select.orderBy());
        assertEquals(10, select.limit());
        assertEquals(5, select.offset());
    }

    @Test
    public void testSelectStar() {
        StatementSpec.Select select = (StatementSpec.Select) new SelectParseStage().parse("select * from users");
        assertTrue(select.selectAll());
        assertNull(select.where());
        assertNull(select.orderBy());
        assertFalse(select.hasLimitOrOffset());
    }

    @Test
    public void testKeywordsInsideLiteralsAreNotClauses() {
        StatementSpec.Select select = (StatementSpec.Select) new SelectParseStage().parse(
            "SELECT * FROM notes WHERE body = 'ORDER BY LIMIT 5' ORDER BY id");
        assertEquals(new Predicate.Leaf("body", Operator.EQUALS, "ORDER BY LIMIT 5"), select.where());
        assertEquals(new StatementSpec.OrderBy("id", StatementSpec.Direction.ASC), select.orderBy());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "SELECT FROM users",
        "SELECT * users",
        "SELECT * FROM users LIMIT 5 WHERE a = 1",
        "SELECT * FROM users ORDER BY",
        "SELECT * FROM users LIMIT x",
        "SELECT * FROM users junk",
        "SELECT a-b FROM users"
    })
    public void testSelectErrors(String sql) {
        assertThrows(StatementSyntaxException.class, () -> new SelectParseStage().parse(sql));
    }

    // ============================================================
    // UPDATE / DELETE / SAVE / LOAD
    // ============================================================

    @Test
    public void testUpdate() {
        StatementSpec.Update update = (StatementSpec.Update) new UpdateParseStage().parse(
            "UPDATE users SET name = 'x, WHERE y', age = 31 WHERE id = 1");

        assertEquals("users", update.table());
        assertEquals("x, WHERE y", update.changes().get("name"));
        assertEquals(31L, update.changes().get("age"));
        assertEquals(new Predicate.Leaf("id", Operator.EQUALS, 1L), update.where());
    }

    @Test
    public void testUpdateAssigningTwiceIsRejected() {
        assertThrows(StatementSyntaxException.class,
            () -> new UpdateParseStage().parse("UPDATE users SET a = 1, a = 2"));
    }

    @Test
    public void testDelete() {
        StatementSpec.Delete all = (StatementSpec.Delete) new DeleteParseStage().parse("DELETE FROM users");
        assertNull(all.where());

        StatementSpec.Delete some = (StatementSpec.Delete) new DeleteParseStage().parse(
            "DELETE FROM users WHERE email IS NULL");
        assertEquals(new Predicate.Leaf("email", Operator.IS_NULL, null), some.where());
    }

    @Test
    public void testSaveAndLoad() {
        assertEquals(new StatementSpec.SaveDatabase("data/app.json"),
            new DatabaseFileParseStage().parse("SAVE DATABASE 'data/app.json'"));
        assertEquals(new StatementSpec.LoadDatabase("app.json"),
            new DatabaseFileParseStage().parse("load database \"app.json\""));
        assertThrows(StatementSyntaxException.class, () -> new DatabaseFileParseStage().parse("SAVE DATABASE app.json"));
    }

    // ============================================================
    // Stage behaviour
    // ============================================================

    private static String run(Stage parser, String sql) {
        Dispatcher dispatcher = new Dispatcher()
            .register(new Stage() {
                @Override
                public String id() {
                    return "capture";
                }

                @Override
                public boolean appliesTo(WorkUnit unit) {
                    return unit.payload() instanceof Payload.Terminal;
                }

                @Override
                public void transform(WorkUnit unit, StageContext context) {
                    context.capture(unit.payloadAs(Payload.Terminal.class));
                }
            })
            .register(parser)
            .register(new Stage() {
                @Override
                public String id() {
                    return "describe";
                }

                @Override
                public boolean appliesTo(WorkUnit unit) {
                    return unit.payload() instanceof StatementSpec;
                }

                @Override
                public void transform(WorkUnit unit, StageContext context) {
                    context.emit(Payload.Terminal.success(unit.payload().describe()));
                }
            });
        dispatcher.submit(new Payload.Statement(sql));
        DispatchResult result = dispatcher.run();
        return result.terminal().map(Payload.Terminal::render).orElse("<none>");
    }

    @Test
    public void testParserAppliesOnlyToItsOwnKeyword() {
        assertEquals("<none>", run(new DeleteParseStage(), "SELECT * FROM t"));
        assertEquals("delete from t", run(new DeleteParseStage(), "  delete from t;"));
    }

    @Test
    public void testWhereSyntaxErrorBecomesErrorTerminal() {
        assertEquals("ERROR: Invalid WHERE condition: age IS 3",
            run(new DeleteParseStage(), "DELETE FROM t WHERE age IS 3"));
    }

    @Test
    public void testStatementSyntaxErrorCarriesExpectedGrammar() {
        String result = run(new DropTableParseStage(), "DROP TABLE");
        assertTrue(result.startsWith("ERROR: "));
        assertTrue(result.contains("Expected: DROP TABLE"));
    }

    @Test
    public void testScriptSplitting() {
        assertEquals(Lists.immutable.with("INSERT INTO t VALUES ('a;b')", "SELECT * FROM t"),
            StatementSplitter.split("INSERT INTO t VALUES ('a;b');\n SELECT * FROM t;;  "));
    }
}
