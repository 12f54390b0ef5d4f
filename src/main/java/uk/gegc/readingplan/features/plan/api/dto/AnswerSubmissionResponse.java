package uk.gegc.readingplan.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.plan.domain.model.DayState;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Schema(name = "AnswerSubmissionResponse", description = "Outcome of saving answers for a day")
public record AnswerSubmissionResponse(
        @Schema(example = "Day 1 completed successfully") String message,
        AnsweredDay day,
        @Schema(description = "Index of the day unlocked by this completion, if any", example = "2")
        Integer nextDayUnlocked,
        boolean planComplete
) {

    public record AnsweredDay(UUID id, int index, DayState state, Instant completedAt, Map<String, Object> answers) {
    }
}
