package uk.gegc.readingplan.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.ai.application.PromptTemplateService;
import uk.gegc.readingplan.features.student.application.StudentProfile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildSystemPrompt() {
        return loadPromptTemplate("system-prompt.txt");
    }

    @Override
    public String buildStoryPrompt(StudentProfile student, String theme, int chapterCount) {
        if (theme == null || theme.isBlank()) {
            throw new IllegalArgumentException("Theme cannot be empty");
        }
        if (chapterCount < 1) {
            throw new IllegalArgumentException("Chapter count must be positive");
        }
        return applyStudent(loadPromptTemplate("story.txt"), student)
                .replace("{theme}", theme)
                .replace("{chapterCount}", String.valueOf(chapterCount));
    }

    @Override
    public String buildActivityPrompt(StudentProfile student, String chapterText, ActivityType type) {
        if (type == null) {
            throw new IllegalArgumentException("Activity type cannot be null");
        }
        String chapter = chapterText != null ? chapterText : "";
        return applyStudent(loadPromptTemplate("activities/" + type.getKey() + ".txt"), student)
                .replace("{chapter}", chapter);
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String applyStudent(String template, StudentProfile student) {
        String interests = student.interests() == null || student.interests().isEmpty()
                ? "none given"
                : String.join(", ", student.interests());
        return template
                .replace("{age}", String.valueOf(student.age()))
                .replace("{gradeLevel}", student.gradeLevel() != null ? String.valueOf(student.gradeLevel()) : "unknown")
                .replace("{interests}", interests);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new IllegalStateException("Failed to load template: " + templateName, e);
        }
    }
}
