package uk.gegc.readingplan.features.ai.application;

import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.student.application.StudentProfile;

/**
 * Builds generator prompts from the templates under {@code classpath:prompts/}.
 */
public interface PromptTemplateService {

    String buildSystemPrompt();

    String buildStoryPrompt(StudentProfile student, String theme, int chapterCount);

    String buildActivityPrompt(StudentProfile student, String chapterText, ActivityType type);

    String loadPromptTemplate(String templateName);
}
