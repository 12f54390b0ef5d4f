package uk.gegc.readingplan.features.plan.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanStatus {
    GENERATING("generating"),
    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    PlanStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
