package uk.gegc.readingplan.features.activity.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressDto;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressUpdateRequest;
import uk.gegc.readingplan.features.activity.application.ActivityProgressService;
import uk.gegc.readingplan.features.activity.domain.model.ActivityProgress;
import uk.gegc.readingplan.features.activity.domain.model.ActivityProgressStatus;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.activity.domain.repository.ActivityProgressRepository;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityProgressServiceImpl implements ActivityProgressService {

    private final ActivityProgressRepository progressRepository;
    private final PlanStore planStore;
    private final Clock clock;

    @Override
    @Transactional
    public ActivityProgressDto updateProgress(String accountUsername, ActivityProgressUpdateRequest request) {
        ActivityType type = ActivityType.fromKey(request.activityType())
                .orElseThrow(() -> new ValidationException("Unknown activity type: " + request.activityType()));
        PlanDay day = planStore.getDay(request.planId(), request.dayIndex(), accountUsername);
        if (day.isLocked()) {
            throw new PlanStateException(ErrorCode.DAY_LOCKED, "Day " + request.dayIndex() + " is locked");
        }
        Plan plan = day.getPlan();
        Long studentId = plan.getStudent().getId();

        ActivityProgress progress = findOrCreate(studentId, plan.getId(), request.dayIndex(), type);
        progress.record(request.status(), request.timeSpentSeconds(), Instant.now(clock));
        ActivityProgress saved = progressRepository.save(progress);
        log.debug("Progress for {} on plan {} day {} is now {}",
                type.getKey(), plan.getId(), request.dayIndex(), saved.getStatus());
        return toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, ActivityProgressDto> getDayProgress(UUID planId, int dayIndex, String accountUsername) {
        PlanDay day = planStore.getDay(planId, dayIndex, accountUsername);
        if (day.isLocked()) {
            throw new PlanStateException(ErrorCode.DAY_LOCKED, "Day " + dayIndex + " is locked");
        }
        return findDayProgress(planId, dayIndex);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, ActivityProgressDto> findDayProgress(UUID planId, int dayIndex) {
        Map<String, ActivityProgressDto> result = new LinkedHashMap<>();
        progressRepository.findByPlanIdAndDayIndex(planId, dayIndex).stream()
                .sorted(Comparator.comparing(ActivityProgress::getActivityType))
                .forEach(progress -> result.put(progress.getActivityType().getKey(), toDto(progress)));
        return result;
    }

    @Override
    @Transactional
    public void recordAnswerOutcome(Long studentId, UUID planId, int dayIndex, ActivityType type, boolean completed) {
        ActivityProgress progress = findOrCreate(studentId, planId, dayIndex, type);
        Instant now = Instant.now(clock);
        if (completed) {
            if (progress.getStatus() != ActivityProgressStatus.COMPLETED) {
                progress.record(ActivityProgressStatus.COMPLETED, null, now);
            }
        } else if (progress.getStatus() == ActivityProgressStatus.NOT_STARTED) {
            progress.record(ActivityProgressStatus.IN_PROGRESS, null, now);
        }
        progressRepository.save(progress);
    }

    private ActivityProgress findOrCreate(Long studentId, UUID planId, int dayIndex, ActivityType type) {
        return progressRepository.findByStudentIdAndPlanIdAndDayIndexAndActivityType(studentId, planId, dayIndex, type)
                .orElseGet(() -> new ActivityProgress(studentId, planId, dayIndex, type));
    }

    private ActivityProgressDto toDto(ActivityProgress progress) {
        return new ActivityProgressDto(
                progress.getActivityType().getKey(),
                progress.getStatus(),
                progress.getStartedAt(),
                progress.getCompletedAt(),
                progress.getTimeSpentSeconds(),
                progress.getAttempts()
        );
    }
}
