package uk.gegc.readingplan.features.ai.application;

import java.util.List;

/**
 * Story returned by the content generator, one chapter per plan day.
 */
public record GeneratedStory(
        String title,
        List<String> themes,
        List<String> chapters
) {
}
