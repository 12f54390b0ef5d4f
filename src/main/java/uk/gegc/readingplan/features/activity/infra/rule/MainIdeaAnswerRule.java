package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

/**
 * Main idea answers are the selected option identifiers: non-negative option indexes
 * or non-blank option ids. Free-text answers are not accepted.
 */
@Component
public class MainIdeaAnswerRule extends ActivityAnswerRule {

    @Override
    public ActivityType supportedType() {
        return ActivityType.MAIN_IDEA;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isArray() || response.isEmpty()) {
            return ValidationOutcome.invalid("Main idea activity requires at least one selected option");
        }
        for (JsonNode selection : response) {
            boolean index = selection.isIntegralNumber() && selection.asLong() >= 0;
            boolean id = selection.isTextual() && !selection.asText().isBlank();
            if (!index && !id) {
                return ValidationOutcome.invalid("Main idea selections must be option indexes or option ids");
            }
        }
        return ValidationOutcome.ok();
    }
}
