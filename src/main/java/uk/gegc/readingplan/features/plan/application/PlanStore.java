package uk.gegc.readingplan.features.plan.application;

import uk.gegc.readingplan.features.ai.application.GeneratedStory;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;
import uk.gegc.readingplan.features.student.domain.model.Student;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence and ownership checks for the plan aggregate (plan, story, days).
 *
 * <p>Lookups scoped to an account report absence and foreign ownership the same way,
 * as {@code PLAN_NOT_FOUND}. Storage failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}s.
 */
public interface PlanStore {

    Plan createPlanStub(Student student, String name, String theme, PlanVariant variant);

    Plan attachStory(UUID planId, GeneratedStory story);

    /**
     * Creates days 1..count: day 1 AVAILABLE, every other day LOCKED.
     */
    List<PlanDay> createDays(UUID planId, int count);

    Plan getPlanWithDays(UUID planId, String accountUsername);

    /**
     * Loads a plan without an ownership check, for background tasks.
     */
    Plan getPlanForGeneration(UUID planId);

    Plan updatePlanStatus(UUID planId, PlanStatus status, String failureReason);

    Optional<Plan> findRecentGeneratingPlan(Long studentId, Instant since);

    /**
     * GENERATING plans created before {@code cutoff}, for the watchdog.
     */
    List<Plan> findStaleGeneratingPlans(Instant cutoff);

    Optional<Plan> findLatestPlanForStudent(Long studentId, String accountUsername);

    /**
     * Returns the day with the given index of an owned plan.
     *
     * @throws uk.gegc.readingplan.shared.exception.ValidationException when the index is outside 1..N
     * @throws uk.gegc.readingplan.shared.exception.ResourceNotFoundException when the plan is not
     *         visible or the day has not been created yet
     */
    PlanDay getDay(UUID planId, int dayIndex, String accountUsername);
}
