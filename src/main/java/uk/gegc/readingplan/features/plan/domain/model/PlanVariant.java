package uk.gegc.readingplan.features.plan.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Plan length. The number of days equals the number of story chapters.
 */
public enum PlanVariant {
    THREE_DAY("3-day", 3),
    FIVE_DAY("5-day", 5);

    private final String value;
    private final int dayCount;

    PlanVariant(String value, int dayCount) {
        this.value = value;
        this.dayCount = dayCount;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getDayCount() {
        return dayCount;
    }

    @JsonCreator
    public static PlanVariant fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim();
        for (PlanVariant variant : values()) {
            if (variant.value.equalsIgnoreCase(normalized)
                    || variant.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
                return variant;
            }
        }
        throw new IllegalArgumentException("Unsupported plan variant: " + raw.toLowerCase(Locale.ROOT));
    }
}
