package uk.gegc.readingplan.features.activity.application;

import uk.gegc.readingplan.features.activity.api.dto.RegeneratedActivityResponse;
import uk.gegc.readingplan.features.plan.domain.model.Plan;

import java.util.UUID;

public interface ActivityService {

    RegeneratedActivityResponse regenerate(UUID planId, int dayIndex, String activityType, String accountUsername);

    int clearDayCache(UUID planId, int dayIndex, String accountUsername);

    ActivityGenerationContext contextFor(Plan plan, int dayIndex);
}
