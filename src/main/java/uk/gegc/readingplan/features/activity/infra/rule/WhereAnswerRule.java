package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

@Component
public class WhereAnswerRule extends ActivityAnswerRule {

    static final int MIN_LENGTH = 10;

    @Override
    public ActivityType supportedType() {
        return ActivityType.WHERE;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isTextual() || response.asText().trim().length() < MIN_LENGTH) {
            return ValidationOutcome.invalid(
                    "Where activity requires a text response of at least " + MIN_LENGTH + " characters");
        }
        return ValidationOutcome.ok();
    }
}
