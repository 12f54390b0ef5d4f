package uk.gegc.readingplan.features.plan.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "PlanProgressDto", description = "Day counts and overall completion of a plan")
public record PlanProgressDto(
        int totalDays,
        int completedDays,
        int availableDays,
        int lockedDays,
        @Schema(description = "Completed days as a percentage", example = "33")
        int progress,
        @Schema(description = "Lowest AVAILABLE day index, null when none", example = "2")
        Integer nextAvailableDay,
        @JsonProperty("isComplete")
        boolean isComplete
) {
}
