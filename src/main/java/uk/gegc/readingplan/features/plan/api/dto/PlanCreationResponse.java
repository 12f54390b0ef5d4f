package uk.gegc.readingplan.features.plan.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

import java.util.UUID;

@Schema(name = "PlanCreationResponse", description = "Immediate answer to a plan creation request")
public record PlanCreationResponse(
        @Schema(example = "3-day plan generation started")
        String message,

        PlanReference plan,

        @Schema(description = "Rough time until the plan becomes active", example = "60")
        int estimatedCompletionSeconds,

        @JsonIgnore
        boolean alreadyInProgress
) {

    public static PlanCreationResponse started(UUID planId, PlanVariant variant, int estimatedSeconds) {
        return new PlanCreationResponse(
                variant.getValue() + " plan generation started",
                new PlanReference(planId, PlanStatus.GENERATING),
                estimatedSeconds,
                false
        );
    }

    public static PlanCreationResponse inProgress(UUID planId, int estimatedSeconds) {
        return new PlanCreationResponse(
                "Plan generation already in progress",
                new PlanReference(planId, PlanStatus.GENERATING),
                estimatedSeconds,
                true
        );
    }

    @Schema(name = "PlanReference")
    public record PlanReference(UUID id, PlanStatus status) {
    }
}
