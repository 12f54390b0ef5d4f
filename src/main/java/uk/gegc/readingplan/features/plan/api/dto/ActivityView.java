package uk.gegc.readingplan.features.plan.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ActivityView", description = "One activity of a day with its content and the saved response")
public record ActivityView(
        @Schema(example = "main-idea") String type,
        String title,
        String prompt,
        String description,
        boolean required,
        @Schema(description = "Generated or fallback content payload") JsonNode data,
        String contentHash,
        @Schema(description = "True when static fallback content is served") boolean fallback,
        @Schema(description = "Saved response, null when not answered yet") Object response,
        boolean completed
) {
}
