package uk.gegc.readingplan.features.plan.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lock state of a plan day. Transitions only move forward:
 * LOCKED to AVAILABLE to COMPLETE.
 */
public enum DayState {
    LOCKED("locked"),
    AVAILABLE("available"),
    COMPLETE("complete");

    private final String value;

    DayState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
