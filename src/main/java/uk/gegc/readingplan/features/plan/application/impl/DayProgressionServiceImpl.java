package uk.gegc.readingplan.features.plan.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.activity.application.ActivityCatalog;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;
import uk.gegc.readingplan.features.activity.application.ActivityProgressService;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidator;
import uk.gegc.readingplan.features.activity.application.validation.ValidationOutcome;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.plan.api.dto.AnswerSubmissionResponse;
import uk.gegc.readingplan.features.plan.api.dto.SubmitAnswersRequest;
import uk.gegc.readingplan.features.plan.application.DayProgressionService;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.repository.PlanRepository;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ActivitiesIncompleteException;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DayProgressionServiceImpl implements DayProgressionService {

    private final PlanStore planStore;
    private final PlanRepository planRepository;
    private final ActivityCatalog activityCatalog;
    private final AnswerValidator answerValidator;
    private final ActivityContentCache contentCache;
    private final ActivityProgressService activityProgressService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public AnswerSubmissionResponse submitAnswers(UUID planId, int dayIndex, SubmitAnswersRequest request,
                                                  String accountUsername) {
        boolean completeDay = request.completeDayRequested();
        Map<ActivityType, JsonNode> submitted = parseAnswers(request.answers());
        if (submitted.isEmpty() && !completeDay) {
            throw new ValidationException(ErrorCode.INVALID_ANSWERS, "At least one answer is required");
        }

        PlanDay day = planStore.getDay(planId, dayIndex, accountUsername);
        Plan plan = day.getPlan();
        if (day.isLocked()) {
            throw new PlanStateException(ErrorCode.DAY_LOCKED, "Day " + dayIndex + " is locked");
        }
        if (completeDay && day.isComplete()) {
            throw new PlanStateException(ErrorCode.DAY_ALREADY_COMPLETE, "Day " + dayIndex + " is already complete");
        }

        Map<String, Object> converted = new LinkedHashMap<>();
        submitted.forEach((type, response) -> converted.put(type.getKey(), objectMapper.convertValue(response, Object.class)));

        AnswerValidationContext context = contentCache.validationContext(planId, dayIndex);
        Long studentId = plan.getStudent().getId();

        if (!completeDay) {
            day.mergeAnswers(converted);
            submitted.forEach((type, response) -> activityProgressService.recordAnswerOutcome(
                    studentId, planId, dayIndex, type, answerValidator.validate(type, response, context).valid()));
            planRepository.flush();
            log.debug("Saved {} answers for plan {} day {}", submitted.size(), planId, dayIndex);
            return toResponse("Answers saved successfully", day, null, false);
        }

        Map<ActivityType, JsonNode> merged = new EnumMap<>(ActivityType.class);
        merged.putAll(storedAnswers(day));
        merged.putAll(submitted);

        Set<ActivityType> required = activityCatalog.requiredTypes(plan.getVariant());
        Map<String, String> failures = new LinkedHashMap<>();
        for (ActivityType type : required) {
            ValidationOutcome outcome = answerValidator.validate(type, merged.get(type), context);
            if (!outcome.valid()) {
                failures.put(type.getKey(), outcome.reason());
            }
        }
        if (!failures.isEmpty()) {
            log.info("Completion of plan {} day {} rejected, incomplete activities: {}", planId, dayIndex, failures.keySet());
            throw new ActivitiesIncompleteException(failures);
        }

        Instant now = Instant.now(clock);
        day.mergeAnswers(converted);
        day.complete(now);

        Set<ActivityType> touched = EnumSet.noneOf(ActivityType.class);
        touched.addAll(required);
        touched.addAll(submitted.keySet());
        for (ActivityType type : touched) {
            boolean valid = required.contains(type) || answerValidator.validate(type, merged.get(type), context).valid();
            activityProgressService.recordAnswerOutcome(studentId, planId, dayIndex, type, valid);
        }

        Integer nextDayUnlocked = null;
        boolean planComplete = false;
        if (dayIndex < plan.getDayCount()) {
            int nextIndex = dayIndex + 1;
            plan.findDay(nextIndex).ifPresent(next -> {
                if (next.unlock()) {
                    log.info("Day {} of plan {} unlocked", nextIndex, planId);
                }
            });
            nextDayUnlocked = nextIndex;
        } else {
            planStore.updatePlanStatus(planId, PlanStatus.COMPLETED, null);
            planComplete = true;
        }

        planRepository.flush();
        log.info("Day {} of plan {} completed", dayIndex, planId);
        return toResponse("Day " + dayIndex + " completed successfully", day, nextDayUnlocked, planComplete);
    }

    private Map<ActivityType, JsonNode> parseAnswers(Map<String, JsonNode> answers) {
        Map<ActivityType, JsonNode> parsed = new EnumMap<>(ActivityType.class);
        if (answers == null) {
            return parsed;
        }
        answers.forEach((key, value) -> {
            ActivityType type = ActivityType.fromKey(key)
                    .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_ANSWERS, "Unknown activity type: " + key));
            parsed.put(type, value);
        });
        return parsed;
    }

    private Map<ActivityType, JsonNode> storedAnswers(PlanDay day) {
        Map<ActivityType, JsonNode> stored = new EnumMap<>(ActivityType.class);
        if (day.getAnswers() == null) {
            return stored;
        }
        day.getAnswers().forEach((key, value) -> ActivityType.fromKey(key)
                .ifPresent(type -> stored.put(type, objectMapper.valueToTree(value))));
        return stored;
    }

    private AnswerSubmissionResponse toResponse(String message, PlanDay day, Integer nextDayUnlocked, boolean planComplete) {
        return new AnswerSubmissionResponse(
                message,
                new AnswerSubmissionResponse.AnsweredDay(
                        day.getId(), day.getDayIndex(), day.getState(), day.getCompletedAt(), day.getAnswers()),
                nextDayUnlocked,
                planComplete
        );
    }
}
