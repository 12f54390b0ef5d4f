package uk.gegc.readingplan.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "PlanDetailsResponse", description = "A plan with its story, days and progress summary")
public record PlanDetailsResponse(
        UUID id,
        Long studentId,
        String name,
        String theme,
        PlanVariant variant,
        PlanStatus status,
        @Schema(description = "Set only while the plan is failed")
        String failureReason,
        Instant createdAt,
        Instant completedAt,
        @Schema(description = "Null while the plan is still generating")
        StoryDto story,
        List<DayDto> days,
        PlanProgressDto planStatus
) {
}
