package uk.gegc.readingplan.features.plan.application.generation;

import uk.gegc.readingplan.features.plan.api.dto.CreatePlanRequest;
import uk.gegc.readingplan.features.plan.api.dto.PlanCreationResponse;

public interface PlanGenerationOrchestrator {

    /**
     * Creates a GENERATING plan and schedules its generation, or returns the plan whose
     * generation is already running for the same student. Never waits for generation.
     */
    PlanCreationResponse requestPlan(String accountUsername, CreatePlanRequest request);
}
