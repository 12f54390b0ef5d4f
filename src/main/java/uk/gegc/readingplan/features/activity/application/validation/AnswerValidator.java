package uk.gegc.readingplan.features.activity.application.validation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single entry point for answer checks, keyed by activity type. Every call site
 * (day completion, progress sync) goes through the same rule for a given type.
 */
@Component
@Slf4j
public class AnswerValidator {

    private final Map<ActivityType, ActivityAnswerRule> rules = new EnumMap<>(ActivityType.class);

    public AnswerValidator(List<ActivityAnswerRule> answerRules) {
        answerRules.forEach(rule -> {
            ActivityAnswerRule previous = rules.put(rule.supportedType(), rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate answer rule for " + rule.supportedType());
            }
        });
        log.info("AnswerValidator initialized with rules for types: {}", rules.keySet());
    }

    public ValidationOutcome validate(ActivityType type, JsonNode response, AnswerValidationContext context) {
        ActivityAnswerRule rule = rules.get(type);
        if (rule == null) {
            return ValidationOutcome.invalid("No answer rule for activity type " + type.getKey());
        }
        return rule.validate(response, context != null ? context : AnswerValidationContext.none());
    }
}
