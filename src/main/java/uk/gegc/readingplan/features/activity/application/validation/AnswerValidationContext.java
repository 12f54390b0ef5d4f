package uk.gegc.readingplan.features.activity.application.validation;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.Optional;

/**
 * Gives answer rules access to the generated content the student answered against.
 */
@FunctionalInterface
public interface AnswerValidationContext {

    Optional<JsonNode> generatedContent(ActivityType type);

    static AnswerValidationContext none() {
        return type -> Optional.empty();
    }
}
