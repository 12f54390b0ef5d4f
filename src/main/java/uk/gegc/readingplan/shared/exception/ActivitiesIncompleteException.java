package uk.gegc.readingplan.shared.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a day completion is requested but at least one required activity
 * does not validate. Carries the failing activity keys with a reason for each.
 */
public class ActivitiesIncompleteException extends RuntimeException {

    private final Map<String, String> failedActivities;

    public ActivitiesIncompleteException(Map<String, String> failedActivities) {
        super("All required activities must be completed before marking the day as complete");
        this.failedActivities = Collections.unmodifiableMap(new LinkedHashMap<>(failedActivities));
    }

    public Map<String, String> getFailedActivities() {
        return failedActivities;
    }
}
