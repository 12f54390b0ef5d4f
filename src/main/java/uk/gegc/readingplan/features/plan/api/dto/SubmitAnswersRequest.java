package uk.gegc.readingplan.features.plan.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

@Schema(name = "SubmitAnswersRequest", description = "Answers for some or all activities of a day")
public record SubmitAnswersRequest(
        @Schema(description = "Activity key to response", example = "{\"where\":\"In a big forest\",\"predict\":2}")
        @NotNull(message = "answers is required")
        Map<String, JsonNode> answers,

        @Schema(description = "Complete the day after saving; defaults to false")
        Boolean completeDay
) {

    public boolean completeDayRequested() {
        return Boolean.TRUE.equals(completeDay);
    }
}
