package uk.gegc.readingplan.features.ai.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.student.application.StudentProfile;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PromptTemplateServiceImpl Tests")
class PromptTemplateServiceImplTest {

    private final PromptTemplateServiceImpl promptTemplateService =
            new PromptTemplateServiceImpl(new DefaultResourceLoader());

    private final StudentProfile student = new StudentProfile(7L, "Mia", 8, 3, List.of("space", "robots"));

    @Test
    @DisplayName("buildStoryPrompt: fills in student, theme and chapter count")
    void buildStoryPrompt_fillsPlaceholders() {
        // When
        String prompt = promptTemplateService.buildStoryPrompt(student, "space", 5);

        // Then
        assertThat(prompt)
                .contains("aged 8")
                .contains("grade level: 3")
                .contains("space, robots")
                .contains("Theme: space")
                .containsPattern("exactly\\s+5\\s+chapters")
                .doesNotContain("{age}", "{theme}", "{chapterCount}", "{interests}");
    }

    @Test
    @DisplayName("buildStoryPrompt: when student has no interests or grade then placeholders get defaults")
    void buildStoryPrompt_missingStudentDetails_thenDefaults() {
        // When
        String prompt = promptTemplateService.buildStoryPrompt(
                new StudentProfile(8L, "Leo", 6, null, List.of()), "ocean", 3);

        // Then
        assertThat(prompt).contains("none given").contains("grade level: unknown");
    }

    @Test
    @DisplayName("buildStoryPrompt: when theme blank then rejects")
    void buildStoryPrompt_blankTheme_thenRejects() {
        assertThatThrownBy(() -> promptTemplateService.buildStoryPrompt(student, " ", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("buildStoryPrompt: when chapter count not positive then rejects")
    void buildStoryPrompt_zeroChapters_thenRejects() {
        assertThatThrownBy(() -> promptTemplateService.buildStoryPrompt(student, "space", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(ActivityType.class)
    @DisplayName("buildActivityPrompt: every activity type has a template that includes the chapter")
    void buildActivityPrompt_everyType_includesChapter(ActivityType type) {
        // When
        String prompt = promptTemplateService.buildActivityPrompt(student, "Mia met Robo on the moon.", type);

        // Then
        assertThat(prompt).contains("Mia met Robo on the moon.").doesNotContain("{chapter}");
    }

    @Test
    @DisplayName("buildSystemPrompt: loads the system prompt")
    void buildSystemPrompt_loads() {
        assertThat(promptTemplateService.buildSystemPrompt()).isNotBlank();
    }

    @Test
    @DisplayName("loadPromptTemplate: when template missing then IllegalStateException")
    void loadPromptTemplate_missing_thenThrows() {
        assertThatThrownBy(() -> promptTemplateService.loadPromptTemplate("does-not-exist.txt"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does-not-exist.txt");
    }
}
