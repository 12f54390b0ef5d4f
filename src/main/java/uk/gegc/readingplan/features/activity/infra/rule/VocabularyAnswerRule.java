package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vocabulary answers are word/definition match pairs and every pair must be correct.
 *
 * <p>Pairs are checked against the generated word list when it is available; otherwise each
 * pair must carry the client-side {@code isCorrect} verdict.
 */
@Component
public class VocabularyAnswerRule extends ActivityAnswerRule {

    @Override
    public ActivityType supportedType() {
        return ActivityType.VOCABULARY;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isArray() || response.isEmpty()) {
            return ValidationOutcome.invalid("Vocabulary activity requires at least one word match");
        }

        Optional<Map<String, String>> expected = context.generatedContent(ActivityType.VOCABULARY)
                .map(this::expectedDefinitions)
                .filter(map -> !map.isEmpty());

        for (JsonNode pair : response) {
            if (!pair.isObject() || !hasText(pair, "word") || !hasText(pair, "definition")) {
                return ValidationOutcome.invalid("Each vocabulary match needs a word and a definition");
            }
            boolean correct = expected
                    .map(map -> matches(map, pair))
                    .orElseGet(() -> pair.path("isCorrect").asBoolean(false));
            if (!correct) {
                return ValidationOutcome.invalid("Every vocabulary word must be matched to its correct definition");
            }
        }
        return ValidationOutcome.ok();
    }

    private Map<String, String> expectedDefinitions(JsonNode content) {
        Map<String, String> definitions = new HashMap<>();
        for (JsonNode item : content.path("vocabularyWords")) {
            if (hasText(item, "word") && hasText(item, "definition")) {
                definitions.put(normalize(item.get("word").asText()), normalize(item.get("definition").asText()));
            }
        }
        return definitions;
    }

    private boolean matches(Map<String, String> expected, JsonNode pair) {
        String definition = expected.get(normalize(pair.get("word").asText()));
        return definition != null && definition.equals(normalize(pair.get("definition").asText()));
    }

    private boolean hasText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank();
    }

    private String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }
}
