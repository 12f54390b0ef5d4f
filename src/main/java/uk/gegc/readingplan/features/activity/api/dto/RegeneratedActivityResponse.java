package uk.gegc.readingplan.features.activity.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "RegeneratedActivityResponse", description = "Freshly generated content for one activity")
public record RegeneratedActivityResponse(
        boolean success,
        @Schema(example = "vocabulary") String activityType,
        JsonNode content,
        @Schema(description = "SHA-256 of the canonical content") String contentHash,
        Instant regeneratedAt
) {
}
