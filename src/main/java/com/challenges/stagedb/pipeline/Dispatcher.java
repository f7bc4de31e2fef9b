package com.challenges.stagedb.pipeline;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs queued work units through an ordered list of stages.
 *
 * <p>Each dequeued unit is offered to the stages in registration order. The first stage
 * that applies transforms it and the scan stops; every stage visited before that records
 * a decline on the unit. A unit no stage takes is kept as unprocessed and never
 * resubmitted. A run that needs more than {@code maxIterations} dequeues fails with
 * {@link PipelineOverflowException}.
 *
 * <p>Not thread-safe; one dispatcher serves one run at a time.
 */
public class Dispatcher {
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final String runId = "run-" + UUID.randomUUID();
    private final int maxIterations;
    private final TraceLevel traceLevel;
    private final MutableList<Stage> stages = Lists.mutable.empty();
    private final Deque<WorkUnit> queue = new ArrayDeque<>();
    private final MutableList<WorkUnit> unprocessed = Lists.mutable.empty();
    private final Context context = new Context();

    private Payload.Terminal result;

    public Dispatcher() {
        this(DEFAULT_MAX_ITERATIONS, TraceLevel.MINIMAL);
    }

    public Dispatcher(int maxIterations, TraceLevel traceLevel) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.traceLevel = traceLevel;
    }

    public String runId() {
        return runId;
    }

    /**
     * Appends a stage. Order is significant: the first applicable stage wins.
     */
    public Dispatcher register(Stage stage) {
        if (stages.anySatisfy(existing -> existing.id().equals(stage.id()))) {
            throw new IllegalArgumentException("Stage id already registered: " + stage.id());
        }
        stages.add(stage);
        return this;
    }

    public ImmutableList<String> stageIds() {
        return stages.collect(Stage::id).toImmutable();
    }

    public void submit(WorkUnit unit) {
        queue.addLast(unit);
    }

    public void submit(Payload payload) {
        submit(WorkUnit.of(payload, runId));
    }

    /**
     * Drains the queue.
     *
     * @throws PipelineOverflowException if the iteration budget runs out with work left
     */
    public DispatchResult run() {
        int iterations = 0;

        while (!queue.isEmpty()) {
            if (iterations >= maxIterations) {
                log.error("Run {} exceeded {} iterations with {} unit(s) still queued", runId, maxIterations, queue.size());
                queue.clear();
                throw new PipelineOverflowException(maxIterations);
            }
            iterations++;

            WorkUnit unit = queue.removeFirst().withTotalStages(stages.size());
            boolean processed = false;

            for (Stage stage : stages) {
                if (stage.appliesTo(unit)) {
                    log.trace("{} -> {}", stage.id(), unit.payload().describe());
                    context.enter(unit, stage);
                    try {
                        stage.transform(unit, context);
                    } finally {
                        context.leave();
                    }
                    processed = true;
                    break;
                }
                unit = unit.declinedBy(stage.id());
            }

            if (!processed && unit.exhausted()) {
                log.debug("Run {}: no stage accepted '{}'", runId, unit.payload().describe());
                unprocessed.add(unit);
            }
        }

        log.debug("Run {} finished after {} iteration(s)", runId, iterations);
        return new DispatchResult(runId, Optional.ofNullable(result), unprocessed.toImmutable(), iterations);
    }

    /**
     * Context handed to the stage currently transforming a unit.
     */
    private final class Context implements StageContext {
        private WorkUnit current;
        private Stage currentStage;

        void enter(WorkUnit unit, Stage stage) {
            current = unit;
            currentStage = stage;
        }

        void leave() {
            current = null;
            currentStage = null;
        }

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public void emit(Payload payload) {
            if (current == null) {
                throw new IllegalStateException("emit called outside of a transform");
            }
            Trace trace = current.trace().derive(
                currentStage.id(), current.payload().describe(), payload.describe(), traceLevel);
            queue.addLast(new WorkUnit(payload, runId, trace));
        }

        @Override
        public void capture(Payload.Terminal terminal) {
            if (result != null) {
                log.debug("Run {}: result '{}' replaced by '{}'", runId, result.render(), terminal.render());
            }
            result = terminal;
        }
    }
}
