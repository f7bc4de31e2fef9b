package com.challenges.stagedb.pipeline;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Optional;

/**
 * Outcome of {@link Dispatcher#run()}.
 *
 * @param runId       id stamped on every unit of the run
 * @param terminal    last captured result, if any stage produced one
 * @param unprocessed units every stage declined
 * @param iterations  number of dequeues
 */
public record DispatchResult(String runId,
                             Optional<Payload.Terminal> terminal,
                             ImmutableList<WorkUnit> unprocessed,
                             int iterations) {
}
