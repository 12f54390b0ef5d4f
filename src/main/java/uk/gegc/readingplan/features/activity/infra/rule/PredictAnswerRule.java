package uk.gegc.readingplan.features.activity.infra.rule;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.validation.ActivityAnswerRule;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

@Component
public class PredictAnswerRule extends ActivityAnswerRule {

    @Override
    public ActivityType supportedType() {
        return ActivityType.PREDICT;
    }

    @Override
    protected ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context) {
        if (!response.isIntegralNumber() || !response.canConvertToInt() || response.asInt() < 0) {
            return ValidationOutcome.invalid("Predict activity requires the index of the chosen prediction");
        }
        return ValidationOutcome.ok();
    }
}
