package com.challenges.stagedb;

import com.challenges.stagedb.operator.CreateTableExecuteStage;
import com.challenges.stagedb.operator.DeleteExecuteStage;
import com.challenges.stagedb.operator.DistinctStage;
import com.challenges.stagedb.operator.DropTableExecuteStage;
import com.challenges.stagedb.operator.FilterStage;
import com.challenges.stagedb.operator.InsertExecuteStage;
import com.challenges.stagedb.operator.LimitStage;
import com.challenges.stagedb.operator.LoadDatabaseStage;
import com.challenges.stagedb.operator.OrderStage;
import com.challenges.stagedb.operator.ProjectStage;
import com.challenges.stagedb.operator.ResultCaptureStage;
import com.challenges.stagedb.operator.ResultFormatStage;
import com.challenges.stagedb.operator.SaveDatabaseStage;
import com.challenges.stagedb.operator.ScanStage;
import com.challenges.stagedb.operator.UpdateExecuteStage;
import com.challenges.stagedb.output.ResultFormatter;
import com.challenges.stagedb.persistence.JsonStorageEngine;
import com.challenges.stagedb.pipeline.DispatchResult;
import com.challenges.stagedb.pipeline.Dispatcher;
import com.challenges.stagedb.pipeline.ExhaustionReport;
import com.challenges.stagedb.pipeline.Payload;
import com.challenges.stagedb.pipeline.PipelineOverflowException;
import com.challenges.stagedb.predicate.PredicateEvaluator;
import com.challenges.stagedb.statement.CreateTableParseStage;
import com.challenges.stagedb.statement.DatabaseFileParseStage;
import com.challenges.stagedb.statement.DeleteParseStage;
import com.challenges.stagedb.statement.DropTableParseStage;
import com.challenges.stagedb.statement.InsertParseStage;
import com.challenges.stagedb.statement.SelectParseStage;
import com.challenges.stagedb.statement.StatementSplitter;
import com.challenges.stagedb.statement.UpdateParseStage;
import com.challenges.stagedb.storage.InMemoryRowStore;
import com.challenges.stagedb.storage.RowStore;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs statements against a row store. Each statement gets its own dispatcher with the
 * standard stage order: result capture, parsers, executors, scan, the relational
 * operators and finally result formatting. The store is the only state kept between
 * statements.
 */
public class QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final RowStore store;
    private final EngineConfig config;
    private final PredicateEvaluator evaluator = new PredicateEvaluator();
    private final JsonStorageEngine storage = new JsonStorageEngine();
    private final ResultFormatter formatter;

    public QueryEngine() {
        this(new InMemoryRowStore(), EngineConfig.defaults());
    }

    public QueryEngine(RowStore store, EngineConfig config) {
        this.store = store;
        this.config = config;
        this.formatter = new ResultFormatter(config.style());
    }

    public RowStore store() {
        return store;
    }

    /**
     * Runs one statement and returns its outcome: a success message, a rendered row set
     * or an {@code ERROR: } line.
     *
     * @throws PipelineOverflowException if the run does not settle within the iteration budget
     */
    public String execute(String sql) {
        Dispatcher dispatcher = newDispatcher();
        dispatcher.submit(new Payload.Statement(sql));
        DispatchResult result = dispatcher.run();

        if (result.terminal().isPresent()) {
            return result.terminal().get().render();
        }
        if (result.unprocessed().notEmpty()) {
            log.debug("Run {} left {} unit(s) unprocessed", result.runId(), result.unprocessed().size());
            return ExhaustionReport.of(result.unprocessed().getFirst(), config.productionErrors()).render();
        }
        // a stage consumed the last unit without emitting a terminal
        return Payload.Terminal.error("Statement produced no result").render();
    }

    /**
     * Splits {@code script} on top-level semicolons and runs each statement in order.
     */
    public ImmutableList<String> executeScript(String script) {
        return StatementSplitter.split(script).collect(this::execute);
    }

    Dispatcher newDispatcher() {
        return new Dispatcher(config.maxIterations(), config.traceLevel())
            .register(new ResultCaptureStage())
            .register(new CreateTableParseStage())
            .register(new DropTableParseStage())
            .register(new InsertParseStage())
            .register(new SelectParseStage())
            .register(new UpdateParseStage())
            .register(new DeleteParseStage())
            .register(new DatabaseFileParseStage())
            .register(new CreateTableExecuteStage(store))
            .register(new DropTableExecuteStage(store))
            .register(new InsertExecuteStage(store))
            .register(new UpdateExecuteStage(store, evaluator))
            .register(new DeleteExecuteStage(store, evaluator))
            .register(new SaveDatabaseStage(store, storage))
            .register(new LoadDatabaseStage(store, storage))
            .register(new ScanStage(store))
            .register(new FilterStage(evaluator))
            .register(new OrderStage())
            .register(new ProjectStage())
            .register(new DistinctStage())
            .register(new LimitStage())
            .register(new ResultFormatStage(formatter));
    }
}
