package uk.gegc.readingplan.features.activity.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum ActivityType {
    WHO("who"),
    WHERE("where"),
    SEQUENCE("sequence"),
    MAIN_IDEA("main-idea"),
    VOCABULARY("vocabulary"),
    PREDICT("predict");

    private final String key;

    ActivityType(String key) {
        this.key = key;
    }

    /**
     * Wire key used in answer maps, URLs and cache rows
     */
    @JsonValue
    public String getKey() {
        return key;
    }

    /**
     * Resolves a wire key. Accepts the camel-case and underscore spellings
     * ({@code mainIdea}, {@code main_idea}) older clients still send.
     */
    public static Optional<ActivityType> fromKey(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim()
                .replace('_', '-')
                .replaceAll("([a-z])([A-Z])", "$1-$2")
                .toLowerCase();
        for (ActivityType type : values()) {
            if (type.key.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
