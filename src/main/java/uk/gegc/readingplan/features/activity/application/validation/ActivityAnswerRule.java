package uk.gegc.readingplan.features.activity.application.validation;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

public abstract class ActivityAnswerRule {

    /**
     * Returns the activity type that this rule checks
     * @return the supported activity type
     */
    public abstract ActivityType supportedType();

    /**
     * Checks a response. Missing or malformed responses are reported as invalid, never thrown.
     */
    public ValidationOutcome validate(JsonNode response, AnswerValidationContext context) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return ValidationOutcome.invalid("Response is missing");
        }
        return doValidate(response, context);
    }

    protected abstract ValidationOutcome doValidate(JsonNode response, AnswerValidationContext context);
}
