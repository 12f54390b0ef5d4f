package uk.gegc.readingplan.features.plan.api.dto;

import java.util.List;

public record StoryDto(String title, List<String> themes, int chapterCount) {
}
