package uk.gegc.readingplan.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "ChapterDto", description = "The chapter read on a day")
public record ChapterDto(
        int number,
        @Schema(example = "Chapter 1") String title,
        String content,
        @Schema(description = "Paragraph key to in-page anchor", example = "{\"paragraph0\":\"#ch1p0\"}")
        Map<String, String> anchors
) {
}
