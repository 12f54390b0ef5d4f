package uk.gegc.readingplan.features.ai.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.ai.application.ContentGenerator;
import uk.gegc.readingplan.features.ai.application.GeneratedStory;
import uk.gegc.readingplan.features.ai.application.PromptTemplateService;
import uk.gegc.readingplan.features.ai.config.AiGenerationProperties;
import uk.gegc.readingplan.features.ai.infra.GeneratedContentValidator;
import uk.gegc.readingplan.features.student.application.StudentProfile;
import uk.gegc.readingplan.shared.exception.ContentGenerationException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link ContentGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Each call is retried up to {@code reading.ai.max-retries} times. Rate limit errors wait with
 * exponential backoff; invalid output is retried immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiContentGenerator implements ContentGenerator {

    private final ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final GeneratedContentValidator contentValidator;
    private final ObjectMapper objectMapper;
    private final AiGenerationProperties properties;

    @Override
    public GeneratedStory generateStory(StudentProfile student, String theme, int chapterCount) {
        String userPrompt = promptTemplateService.buildStoryPrompt(student, theme, chapterCount);
        return withRetries("story", () -> {
            JsonNode root = callForJson(userPrompt);
            GeneratedStory story = toStory(root);
            contentValidator.validateStory(story, chapterCount);
            log.info("Generated story '{}' with {} chapters for student {}", story.title(), chapterCount, student.id());
            return story;
        });
    }

    @Override
    public JsonNode generateActivity(StudentProfile student, String chapterText, ActivityType type) {
        String userPrompt = promptTemplateService.buildActivityPrompt(student, chapterText, type);
        return withRetries(type.getKey() + " activity", () -> {
            JsonNode content = callForJson(userPrompt);
            contentValidator.validateActivity(type, content);
            return content;
        });
    }

    private <T> T withRetries(String what, Supplier<T> attempt) {
        int maxRetries = properties.getMaxRetries();
        int retryCount = 0;

        while (true) {
            try {
                return attempt.get();
            } catch (RuntimeException e) {
                if (retryCount >= maxRetries - 1) {
                    log.error("Generation of {} failed after {} attempts", what, maxRetries, e);
                    throw new ContentGenerationException(
                            "Failed to generate " + what + " after " + maxRetries + " attempts: " + e.getMessage(), e);
                }
                if (isRateLimitError(e)) {
                    long delayMs = calculateBackoffDelay(retryCount);
                    log.warn("Rate limit hit while generating {} (attempt {}). Waiting {} ms", what, retryCount + 1, delayMs);
                    sleepForRateLimit(delayMs);
                } else {
                    log.warn("Generation of {} attempt {} failed: {}", what, retryCount + 1, e.getMessage());
                }
                retryCount++;
            }
        }
    }

    private JsonNode callForJson(String userPrompt) {
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(promptTemplateService.buildSystemPrompt()),
                new UserMessage(userPrompt)
        ));

        ChatResponse response = chatClient.prompt(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null) {
            throw new ContentGenerationException("No response received from AI service");
        }
        String rawResponse = response.getResult().getOutput().getText();
        if (rawResponse == null || rawResponse.trim().isEmpty()) {
            throw new ContentGenerationException("Empty response received from AI service");
        }

        try {
            return objectMapper.readTree(cleanJsonResponse(rawResponse));
        } catch (JsonProcessingException e) {
            throw new ContentGenerationException("Invalid JSON in AI response: " + e.getOriginalMessage(), e);
        }
    }

    private GeneratedStory toStory(JsonNode root) {
        List<String> themes = new ArrayList<>();
        root.path("themes").forEach(theme -> themes.add(theme.asText()));

        List<String> chapters = new ArrayList<>();
        for (JsonNode chapter : root.path("chapters")) {
            // Chapters arrive either as plain text or as {title, content} objects
            chapters.add(chapter.isTextual() ? chapter.asText() : chapter.path("content").asText(""));
        }
        return new GeneratedStory(root.path("title").asText(""), themes, chapters);
    }

    private String cleanJsonResponse(String response) {
        String cleaned = response.trim();

        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }

        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }

        return cleaned.trim();
    }

    private boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429")
                || message.contains("rate limit")
                || message.contains("rate_limit_exceeded")
                || message.contains("Too Many Requests");
    }

    private long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = properties.getBaseDelayMs() * (long) Math.pow(2, retryCount);
        double jitterRange = properties.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
        return Math.min((long) (exponentialDelay * jitter), properties.getMaxDelayMs());
    }

    private void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ContentGenerationException("Interrupted while waiting for rate limit", ie);
        }
    }
}
