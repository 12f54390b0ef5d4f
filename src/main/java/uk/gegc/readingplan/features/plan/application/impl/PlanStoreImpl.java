package uk.gegc.readingplan.features.plan.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.ai.application.GeneratedStory;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.domain.model.DayState;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;
import uk.gegc.readingplan.features.plan.domain.model.Story;
import uk.gegc.readingplan.features.plan.domain.repository.PlanRepository;
import uk.gegc.readingplan.features.student.domain.model.Student;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanStoreImpl implements PlanStore {

    private final PlanRepository planRepository;
    private final Clock clock;

    @Override
    @Transactional
    public Plan createPlanStub(Student student, String name, String theme, PlanVariant variant) {
        Plan plan = Plan.stub(student, name, theme, variant, Instant.now(clock));
        Plan saved = planRepository.saveAndFlush(plan);
        log.info("Created plan stub {} for student {} (variant {})", saved.getId(), student.getId(), variant);
        return saved;
    }

    @Override
    @Transactional
    public Plan attachStory(UUID planId, GeneratedStory generated) {
        Plan plan = getPlanForGeneration(planId);
        if (plan.getStory() != null) {
            throw new IllegalStateException("Plan " + planId + " already has a story");
        }
        plan.attachStory(new Story(generated.title(), generated.themes(), generated.chapters(), Instant.now(clock)));
        return planRepository.save(plan);
    }

    @Override
    @Transactional
    public List<PlanDay> createDays(UUID planId, int count) {
        Plan plan = getPlanForGeneration(planId);
        if (!plan.getDays().isEmpty()) {
            throw new IllegalStateException("Plan " + planId + " already has days");
        }
        for (int index = 1; index <= count; index++) {
            plan.addDay(new PlanDay(index, index == 1 ? DayState.AVAILABLE : DayState.LOCKED));
        }
        planRepository.save(plan);
        return plan.getDays();
    }

    @Override
    @Transactional(readOnly = true)
    public Plan getPlanWithDays(UUID planId, String accountUsername) {
        return planRepository.findByIdAndStudentAccountUsername(planId, accountUsername)
                .orElseThrow(() -> planNotFound(planId));
    }

    @Override
    @Transactional(readOnly = true)
    public Plan getPlanForGeneration(UUID planId) {
        return planRepository.findWithDetailsById(planId)
                .orElseThrow(() -> planNotFound(planId));
    }

    @Override
    @Transactional
    public Plan updatePlanStatus(UUID planId, PlanStatus status, String failureReason) {
        Plan plan = getPlanForGeneration(planId);
        Instant now = Instant.now(clock);
        switch (status) {
            case ACTIVE -> plan.markActive(now);
            case FAILED -> plan.markFailed(failureReason, now);
            case COMPLETED -> plan.markCompleted(now);
            case GENERATING -> throw new IllegalArgumentException("A plan cannot move back to GENERATING");
        }
        log.info("Plan {} moved to {}", planId, status);
        return planRepository.save(plan);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Plan> findRecentGeneratingPlan(Long studentId, Instant since) {
        return planRepository.findFirstByStudentIdAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
                studentId, PlanStatus.GENERATING, since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Plan> findStaleGeneratingPlans(Instant cutoff) {
        return planRepository.findByStatusAndCreatedAtBefore(PlanStatus.GENERATING, cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Plan> findLatestPlanForStudent(Long studentId, String accountUsername) {
        return planRepository.findFirstByStudentIdAndStudentAccountUsernameOrderByCreatedAtDesc(studentId, accountUsername);
    }

    @Override
    @Transactional(readOnly = true)
    public PlanDay getDay(UUID planId, int dayIndex, String accountUsername) {
        Plan plan = getPlanWithDays(planId, accountUsername);
        if (dayIndex < 1 || dayIndex > plan.getDayCount()) {
            throw new ValidationException("Day index must be between 1 and " + plan.getDayCount());
        }
        return plan.findDay(dayIndex)
                .orElseThrow(() -> new ResourceNotFoundException(
                        ErrorCode.DAY_NOT_FOUND, "Day " + dayIndex + " not found"));
    }

    private ResourceNotFoundException planNotFound(UUID planId) {
        return new ResourceNotFoundException(ErrorCode.PLAN_NOT_FOUND, "Plan " + planId + " not found");
    }
}
