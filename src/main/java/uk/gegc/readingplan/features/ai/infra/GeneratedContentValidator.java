package uk.gegc.readingplan.features.ai.infra;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.ai.application.GeneratedStory;
import uk.gegc.readingplan.shared.exception.ContentGenerationException;

import java.util.List;
import java.util.Locale;

/**
 * Structural and wording checks on generator output before it is stored or shown to a child.
 * Every check failure is a {@link ContentGenerationException}, so callers retry or fall back.
 */
@Component
public class GeneratedContentValidator {

    static final List<String> BANNED_WORDS = List.of("violent", "inappropriate", "offensive");

    public void validateStory(GeneratedStory story, int expectedChapters) {
        if (story.title() == null || story.title().isBlank()) {
            throw invalid("Story title is missing");
        }
        List<String> chapters = story.chapters();
        if (chapters == null || chapters.size() != expectedChapters) {
            throw invalid("Story must have exactly " + expectedChapters + " chapters but has "
                    + (chapters == null ? 0 : chapters.size()));
        }
        for (int i = 0; i < chapters.size(); i++) {
            if (chapters.get(i) == null || chapters.get(i).isBlank()) {
                throw invalid("Chapter " + (i + 1) + " is empty");
            }
            checkWording(chapters.get(i));
        }
        checkWording(story.title());
    }

    public void validateActivity(ActivityType type, JsonNode content) {
        if (content == null || !content.isObject()) {
            throw invalid("Activity content must be a JSON object");
        }
        switch (type) {
            case WHO -> {
                requireNamedItems(content, "realCharacters", 2, 6);
                requireNamedItems(content, "decoyCharacters", 1, 4);
            }
            case WHERE -> {
                requireNamedItems(content, "realSettings", 1, 4);
                requireNamedItems(content, "decoySettings", 1, 4);
            }
            case SEQUENCE -> validateSequence(content);
            case MAIN_IDEA -> validateMainIdea(content);
            case VOCABULARY -> validateVocabulary(content);
            case PREDICT -> validatePredict(content);
        }
        checkWording(content.toString());
    }

    private void validateSequence(JsonNode content) {
        JsonNode ordered = requireArray(content, "orderedEvents", 4, 6);
        for (int i = 0; i < ordered.size(); i++) {
            JsonNode event = ordered.get(i);
            if (event.path("id").asInt(-1) != i + 1 || !hasText(event, "text")) {
                throw invalid("orderedEvents must have sequential ids starting at 1 and a text");
            }
        }
        JsonNode shuffled = content.path("shuffledEvents");
        if (!shuffled.isArray() || shuffled.size() != ordered.size()) {
            throw invalid("shuffledEvents must contain every event");
        }
    }

    private void validateMainIdea(JsonNode content) {
        if (!hasText(content, "question")) {
            throw invalid("Main idea question is missing");
        }
        JsonNode options = requireArray(content, "options", 4, 4);
        int correct = 0;
        for (JsonNode option : options) {
            if (!hasText(option, "text")) {
                throw invalid("Every main idea option needs a text");
            }
            if (option.path("isCorrect").asBoolean(false)) {
                correct++;
            }
        }
        if (correct != 1) {
            throw invalid("Exactly one main idea option must be correct, found " + correct);
        }
    }

    private void validateVocabulary(JsonNode content) {
        JsonNode words = requireArray(content, "vocabularyWords", 3, 6);
        for (JsonNode word : words) {
            if (!hasText(word, "word") || !hasText(word, "definition")) {
                throw invalid("Every vocabulary entry needs a word and a definition");
            }
        }
        requireArray(content, "decoyDefinitions", 1, 4);
    }

    private void validatePredict(JsonNode content) {
        JsonNode predictions = requireArray(content, "predictions", 4, 6);
        for (JsonNode prediction : predictions) {
            int score = prediction.path("plausibilityScore").asInt(0);
            if (!hasText(prediction, "text") || score < 1 || score > 10) {
                throw invalid("Every prediction needs a text and a plausibilityScore between 1 and 10");
            }
        }
    }

    private void requireNamedItems(JsonNode content, String field, int min, int max) {
        for (JsonNode item : requireArray(content, field, min, max)) {
            if (!hasText(item, "name")) {
                throw invalid("Every entry of " + field + " needs a name");
            }
        }
    }

    private JsonNode requireArray(JsonNode content, String field, int min, int max) {
        JsonNode array = content.path(field);
        if (!array.isArray() || array.size() < min || array.size() > max) {
            throw invalid(field + " must contain between " + min + " and " + max + " entries");
        }
        return array;
    }

    private boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private void checkWording(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String banned : BANNED_WORDS) {
            if (lower.contains(banned)) {
                throw invalid("Generated content contains a banned word: " + banned);
            }
        }
    }

    private ContentGenerationException invalid(String message) {
        return new ContentGenerationException("Invalid generated content: " + message);
    }
}
