package uk.gegc.readingplan.features.activity.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.activity.domain.model.ActivityProgressStatus;

import java.time.Instant;

@Schema(name = "ActivityProgressDto", description = "Progress of one activity of a plan day")
public record ActivityProgressDto(
        @Schema(description = "Activity key", example = "who")
        String activityType,

        @Schema(description = "Progress status", example = "in_progress")
        ActivityProgressStatus status,

        Instant startedAt,
        Instant completedAt,

        @Schema(description = "Time spent on the activity in seconds", example = "95")
        int timeSpentSeconds,

        @Schema(description = "Number of times the activity was completed", example = "1")
        int attempts
) {
}
