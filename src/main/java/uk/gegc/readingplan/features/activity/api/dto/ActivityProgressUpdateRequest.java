package uk.gegc.readingplan.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import uk.gegc.readingplan.features.activity.domain.model.ActivityProgressStatus;

import java.util.UUID;

@Schema(name = "ActivityProgressUpdateRequest", description = "Progress report for a single activity")
public record ActivityProgressUpdateRequest(
        @NotNull(message = "planId is required")
        UUID planId,

        @NotNull(message = "dayIndex is required")
        @Min(value = 1, message = "dayIndex must be at least 1")
        Integer dayIndex,

        @Schema(description = "Activity key", example = "sequence")
        @NotBlank(message = "activityType is required")
        String activityType,

        @Schema(description = "New status", example = "completed")
        @NotNull(message = "status is required")
        ActivityProgressStatus status,

        @Schema(description = "Total time spent so far in seconds", example = "120")
        @Min(value = 0, message = "timeSpentSeconds must not be negative")
        Integer timeSpentSeconds
) {
}
