package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

@Component
public class WhoAnswerRule extends ActivityAnswerRule {

    @Override
    public ActivityType supportedType() {
        return ActivityType.WHO;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isArray() || response.isEmpty()) {
            return ValidationOutcome.invalid("Who activity requires a non-empty list of characters");
        }
        return ValidationOutcome.ok();
    }
}
