package uk.gegc.readingplan.features.plan.api.dto;

import uk.gegc.readingplan.features.plan.domain.model.DayState;

import java.time.Instant;
import java.util.UUID;

public record DayDto(UUID id, int index, DayState state, Instant completedAt) {
}
