package uk.gegc.readingplan.features.activity.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

/**
 * Static content used whenever the generator fails. Implementations must not fail.
 */
public interface FallbackContentProvider {

    JsonNode fallback(ActivityType type, int studentAge);
}
