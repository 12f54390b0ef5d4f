package uk.gegc.readingplan.features.plan.application;

import uk.gegc.readingplan.features.plan.api.dto.DayDetailResponse;
import uk.gegc.readingplan.features.plan.api.dto.PlanDetailsResponse;
import uk.gegc.readingplan.features.plan.api.dto.PlanStatusResponse;

import java.util.UUID;

public interface PlanQueryService {

    PlanDetailsResponse getPlan(UUID planId, String accountUsername);

    PlanStatusResponse getStatus(UUID planId, String accountUsername);

    PlanDetailsResponse getLatestPlanForStudent(Long studentId, String accountUsername);

    /**
     * Day view with chapter, activities and progress. Activity content comes from the cache and
     * may be generated on the way; generator failures degrade to fallback content.
     */
    DayDetailResponse getDay(UUID planId, int dayIndex, String accountUsername);
}
