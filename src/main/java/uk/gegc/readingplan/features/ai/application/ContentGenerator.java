package uk.gegc.readingplan.features.ai.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.student.application.StudentProfile;

/**
 * Remote content generator. Every call may fail; callers decide whether to fall back,
 * record a failure or surface a 503.
 */
public interface ContentGenerator {

    /**
     * Generates a whole story with exactly {@code chapterCount} chapters.
     *
     * @throws uk.gegc.readingplan.shared.exception.ContentGenerationException when the
     *         generator is unreachable or returns unusable content
     */
    GeneratedStory generateStory(StudentProfile student, String theme, int chapterCount);

    /**
     * Generates the payload of one activity for a single chapter.
     *
     * @throws uk.gegc.readingplan.shared.exception.ContentGenerationException when the
     *         generator is unreachable or returns unusable content
     */
    JsonNode generateActivity(StudentProfile student, String chapterText, ActivityType type);
}
