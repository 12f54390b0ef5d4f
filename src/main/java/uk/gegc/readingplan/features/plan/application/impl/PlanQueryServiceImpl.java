package uk.gegc.readingplan.features.plan.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.readingplan.features.activity.application.ActivityCatalog;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;
import uk.gegc.readingplan.features.activity.application.ActivityContentKey;
import uk.gegc.readingplan.features.activity.application.ActivityGenerationContext;
import uk.gegc.readingplan.features.activity.application.ActivityProgressService;
import uk.gegc.readingplan.features.activity.application.ActivityService;
import uk.gegc.readingplan.features.activity.application.ResolvedActivityContent;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidator;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.plan.api.dto.ActivityView;
import uk.gegc.readingplan.features.plan.api.dto.ChapterDto;
import uk.gegc.readingplan.features.plan.api.dto.DayDetailResponse;
import uk.gegc.readingplan.features.plan.api.dto.DayDto;
import uk.gegc.readingplan.features.plan.api.dto.PlanDetailsResponse;
import uk.gegc.readingplan.features.plan.api.dto.PlanProgressDto;
import uk.gegc.readingplan.features.plan.api.dto.PlanStatusResponse;
import uk.gegc.readingplan.features.plan.api.dto.StoryDto;
import uk.gegc.readingplan.features.plan.application.PlanQueryService;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.config.PlanProperties;
import uk.gegc.readingplan.features.plan.domain.model.DayState;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.Story;
import uk.gegc.readingplan.features.student.application.StudentDirectory;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanQueryServiceImpl implements PlanQueryService {

    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final PlanStore planStore;
    private final StudentDirectory studentDirectory;
    private final ActivityCatalog activityCatalog;
    private final ActivityContentCache contentCache;
    private final ActivityService activityService;
    private final ActivityProgressService activityProgressService;
    private final AnswerValidator answerValidator;
    private final PlanProperties planProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public PlanDetailsResponse getPlan(UUID planId, String accountUsername) {
        return toDetails(planStore.getPlanWithDays(planId, accountUsername));
    }

    @Override
    public PlanStatusResponse getStatus(UUID planId, String accountUsername) {
        Plan plan = planStore.getPlanWithDays(planId, accountUsername);
        Integer estimate = null;
        if (plan.isGenerating()) {
            long elapsed = Duration.between(plan.getCreatedAt(), Instant.now(clock)).getSeconds();
            estimate = (int) Math.max(0, planProperties.getEstimatedGenerationSeconds() - elapsed);
        }
        String failureReason = plan.getStatus() == PlanStatus.FAILED ? plan.getFailureReason() : null;
        return new PlanStatusResponse(plan.getId(), plan.getStatus(), estimate, failureReason, plan.getUpdatedAt());
    }

    @Override
    public PlanDetailsResponse getLatestPlanForStudent(Long studentId, String accountUsername) {
        studentDirectory.getOwnedStudent(studentId, accountUsername);
        return planStore.findLatestPlanForStudent(studentId, accountUsername)
                .map(this::toDetails)
                .orElseThrow(() -> new ResourceNotFoundException(
                        ErrorCode.PLAN_NOT_FOUND, "No plan found for student " + studentId));
    }

    @Override
    public DayDetailResponse getDay(UUID planId, int dayIndex, String accountUsername) {
        PlanDay day = planStore.getDay(planId, dayIndex, accountUsername);
        if (day.isLocked()) {
            throw new PlanStateException(ErrorCode.DAY_LOCKED, "Day " + dayIndex + " is locked");
        }
        Plan plan = day.getPlan();
        Story story = plan.getStory();
        ActivityGenerationContext generationContext = activityService.contextFor(plan, dayIndex);

        Map<ActivityType, ResolvedActivityContent> resolved = new EnumMap<>(ActivityType.class);
        for (ActivityType type : activityCatalog.offeredTypes()) {
            resolved.put(type, contentCache.resolve(new ActivityContentKey(planId, dayIndex, type), generationContext));
        }
        AnswerValidationContext validationContext = contentCache.validationContext(planId, dayIndex);

        Set<ActivityType> required = activityCatalog.requiredTypes(plan.getVariant());
        List<ActivityView> activities = new ArrayList<>();
        int requiredDone = 0;
        for (Map.Entry<ActivityType, ResolvedActivityContent> entry : resolved.entrySet()) {
            ActivityType type = entry.getKey();
            ResolvedActivityContent content = entry.getValue();
            Object response = day.getAnswers() != null ? day.getAnswers().get(type.getKey()) : null;
            boolean completed = response != null && answerValidator
                    .validate(type, objectMapper.valueToTree(response), validationContext).valid();
            if (completed && required.contains(type)) {
                requiredDone++;
            }
            ActivityCatalog.ActivityDescriptor descriptor = activityCatalog.describe(type, dayIndex, plan.getDayCount());
            activities.add(new ActivityView(
                    type.getKey(),
                    descriptor.title(),
                    descriptor.prompt(),
                    descriptor.description(),
                    required.contains(type),
                    content.content(),
                    content.contentHash(),
                    content.fallback(),
                    response,
                    completed
            ));
        }
        int dayProgress = required.isEmpty() ? 0 : requiredDone * 100 / required.size();

        String chapterText = story != null ? story.chapter(dayIndex) : "";
        return new DayDetailResponse(
                new DayDetailResponse.PlanSummary(plan.getId(), plan.getName(), plan.getTheme(), plan.getVariant(),
                        new DayDetailResponse.StudentSummary(plan.getStudent().getId(), plan.getStudent().getName())),
                new DayDetailResponse.DayView(day.getId(), dayIndex, day.getState(), day.getCompletedAt(), dayProgress),
                new ChapterDto(dayIndex, "Chapter " + dayIndex, chapterText, anchors(dayIndex, chapterText)),
                activities,
                story != null ? new DayDetailResponse.StorySummary(story.getTitle(), story.getThemes()) : null,
                activityProgressService.findDayProgress(planId, dayIndex)
        );
    }

    private Map<String, String> anchors(int chapterNumber, String content) {
        Map<String, String> anchors = new LinkedHashMap<>();
        if (content == null || content.isEmpty()) {
            return anchors;
        }
        String[] paragraphs = content.split(PARAGRAPH_SEPARATOR);
        for (int i = 0; i < paragraphs.length; i++) {
            anchors.put("paragraph" + i, "#ch" + chapterNumber + "p" + i);
        }
        return anchors;
    }

    private PlanDetailsResponse toDetails(Plan plan) {
        Story story = plan.getStory();
        List<DayDto> days = plan.getDays().stream()
                .map(day -> new DayDto(day.getId(), day.getDayIndex(), day.getState(), day.getCompletedAt()))
                .toList();
        return new PlanDetailsResponse(
                plan.getId(),
                plan.getStudent().getId(),
                plan.getName(),
                plan.getTheme(),
                plan.getVariant(),
                plan.getStatus(),
                plan.getStatus() == PlanStatus.FAILED ? plan.getFailureReason() : null,
                plan.getCreatedAt(),
                plan.getCompletedAt(),
                story != null ? new StoryDto(story.getTitle(), story.getThemes(), story.getChapters().size()) : null,
                days,
                progressOf(plan)
        );
    }

    private PlanProgressDto progressOf(Plan plan) {
        int total = plan.getDayCount();
        int completed = 0;
        int available = 0;
        int locked = 0;
        Integer nextAvailable = null;
        for (PlanDay day : plan.getDays()) {
            if (day.getState() == DayState.COMPLETE) {
                completed++;
            } else if (day.getState() == DayState.AVAILABLE) {
                available++;
                if (nextAvailable == null || day.getDayIndex() < nextAvailable) {
                    nextAvailable = day.getDayIndex();
                }
            } else {
                locked++;
            }
        }
        int progress = total == 0 ? 0 : completed * 100 / total;
        return new PlanProgressDto(total, completed, available, locked, progress, nextAvailable,
                plan.getStatus() == PlanStatus.COMPLETED);
    }
}
