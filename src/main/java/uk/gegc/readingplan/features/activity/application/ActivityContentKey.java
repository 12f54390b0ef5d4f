package uk.gegc.readingplan.features.activity.application;

import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.UUID;

public record ActivityContentKey(UUID planId, int dayIndex, ActivityType type) {
}
