package uk.gegc.readingplan.features.activity.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.readingplan.features.activity.api.dto.RegeneratedActivityResponse;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;
import uk.gegc.readingplan.features.activity.application.ActivityContentKey;
import uk.gegc.readingplan.features.activity.application.ActivityGenerationContext;
import uk.gegc.readingplan.features.activity.application.ActivityService;
import uk.gegc.readingplan.features.activity.application.ResolvedActivityContent;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.student.application.StudentDirectory;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityServiceImpl implements ActivityService {

    private final PlanStore planStore;
    private final ActivityContentCache contentCache;
    private final StudentDirectory studentDirectory;
    private final Clock clock;

    @Override
    public RegeneratedActivityResponse regenerate(UUID planId, int dayIndex, String activityType, String accountUsername) {
        ActivityType type = ActivityType.fromKey(activityType)
                .orElseThrow(() -> new ValidationException("Unknown activity type: " + activityType));
        PlanDay day = planStore.getDay(planId, dayIndex, accountUsername);
        if (day.isLocked()) {
            throw new PlanStateException(ErrorCode.DAY_LOCKED, "Day " + dayIndex + " is locked");
        }

        Plan plan = day.getPlan();
        ResolvedActivityContent content = contentCache.regenerate(
                new ActivityContentKey(planId, dayIndex, type), contextFor(plan, dayIndex));
        return new RegeneratedActivityResponse(
                true,
                type.getKey(),
                content.content(),
                content.contentHash(),
                Instant.now(clock)
        );
    }

    @Override
    public int clearDayCache(UUID planId, int dayIndex, String accountUsername) {
        planStore.getDay(planId, dayIndex, accountUsername);
        return contentCache.clearDay(planId, dayIndex);
    }

    @Override
    public ActivityGenerationContext contextFor(Plan plan, int dayIndex) {
        String chapter = plan.getStory() != null ? plan.getStory().chapter(dayIndex) : "";
        return new ActivityGenerationContext(studentDirectory.toProfile(plan.getStudent()), chapter);
    }
}
