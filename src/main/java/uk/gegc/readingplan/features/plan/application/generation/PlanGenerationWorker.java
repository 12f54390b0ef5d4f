package uk.gegc.readingplan.features.plan.application.generation;

import java.util.UUID;

/**
 * Runs the deferred part of plan generation. Never throws: outcomes are written to the plan.
 */
public interface PlanGenerationWorker {

    /**
     * Generates the story for a GENERATING plan and activates it, or marks it FAILED.
     * Releases the in-memory lock and the durable lease when done.
     */
    void generate(UUID planId);

    /**
     * Fails plans that have been GENERATING longer than the configured stale period.
     *
     * @return number of plans marked FAILED
     */
    int failStaleGenerations();
}
