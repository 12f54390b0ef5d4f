package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

@Component
public class SequenceAnswerRule extends ActivityAnswerRule {

    @Override
    public ActivityType supportedType() {
        return ActivityType.SEQUENCE;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isArray() || response.isEmpty()) {
            return ValidationOutcome.invalid("Sequence activity requires a non-empty list of ordered events");
        }
        return ValidationOutcome.ok();
    }
}
