package uk.gegc.readingplan.features.plan.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "PlanStatusResponse", description = "Lightweight status for polling a generating plan")
public record PlanStatusResponse(
        UUID planId,
        PlanStatus status,
        @Schema(description = "Present while generating", example = "45")
        Integer estimatedCompletionSeconds,
        @Schema(description = "Present when failed", example = "timeout")
        String failureReason,
        Instant updatedAt
) {
}
