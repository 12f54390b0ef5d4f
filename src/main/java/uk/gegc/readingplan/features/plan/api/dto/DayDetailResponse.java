package uk.gegc.readingplan.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressDto;
import uk.gegc.readingplan.features.plan.domain.model.DayState;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(name = "DayDetailResponse", description = "Everything needed to render one day of a plan")
public record DayDetailResponse(
        PlanSummary plan,
        DayView day,
        ChapterDto chapter,
        List<ActivityView> activities,
        StorySummary story,
        Map<String, ActivityProgressDto> progress
) {

    public record PlanSummary(UUID id, String name, String theme, PlanVariant variant, StudentSummary student) {
    }

    public record StudentSummary(Long id, String name) {
    }

    public record DayView(
            UUID id,
            int index,
            DayState state,
            Instant completedAt,
            @Schema(description = "Share of required activities with a valid answer, in percent", example = "40")
            int progress
    ) {
    }

    public record StorySummary(String title, List<String> themes) {
    }
}
