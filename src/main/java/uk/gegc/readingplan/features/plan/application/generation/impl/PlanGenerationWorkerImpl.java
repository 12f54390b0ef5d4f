package uk.gegc.readingplan.features.plan.application.generation.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.readingplan.features.ai.application.ContentGenerator;
import uk.gegc.readingplan.features.ai.application.GeneratedStory;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.application.generation.GenerationLockRegistry;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationWorker;
import uk.gegc.readingplan.features.plan.config.PlanProperties;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.repository.GenerationLeaseRepository;
import uk.gegc.readingplan.features.student.application.StudentDirectory;
import uk.gegc.readingplan.features.student.application.StudentProfile;
import uk.gegc.readingplan.shared.exception.ContentGenerationException;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationWorkerImpl implements PlanGenerationWorker {

    static final String TIMEOUT_REASON = "timeout";
    private static final int MAX_REASON_LENGTH = 500;

    private final PlanStore planStore;
    private final StudentDirectory studentDirectory;
    private final ContentGenerator contentGenerator;
    private final GenerationLockRegistry lockRegistry;
    private final GenerationLeaseRepository leaseRepository;
    private final PlanProperties planProperties;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    @Qualifier("contentGeneratorExecutor")
    private final Executor contentGeneratorExecutor;

    @Override
    public void generate(UUID planId) {
        Plan plan;
        try {
            plan = planStore.getPlanForGeneration(planId);
        } catch (ResourceNotFoundException e) {
            log.warn("Plan {} disappeared before generation started", planId);
            leaseRepository.deleteByPlanId(planId);
            return;
        }
        if (!plan.isGenerating()) {
            log.info("Plan {} is {} already, skipping generation", planId, plan.getStatus());
            leaseRepository.deleteByPlanId(planId);
            return;
        }

        Long studentId = plan.getStudent().getId();
        if (!lockRegistry.tryAcquire(studentId, planId)) {
            UUID holder = lockRegistry.holder(studentId).orElse(null);
            log.warn("Student {} already has generation of plan {} running; failing plan {}", studentId, holder, planId);
            markFailed(planId, "another plan is being generated for this student");
            recordOutcome("rejected");
            leaseRepository.deleteByPlanId(planId);
            return;
        }

        long startedAt = System.nanoTime();
        try {
            StudentProfile profile = studentDirectory.toProfile(plan.getStudent());
            int dayCount = plan.getDayCount();
            GeneratedStory story = generateStory(profile, plan.getTheme(), dayCount);
            if (story.chapters() == null || story.chapters().size() != dayCount) {
                throw new ContentGenerationException("Story has " + (story.chapters() == null ? 0 : story.chapters().size())
                        + " chapters, expected " + dayCount);
            }

            transactionTemplate.executeWithoutResult(status -> {
                planStore.attachStory(planId, story);
                planStore.createDays(planId, dayCount);
                planStore.updatePlanStatus(planId, PlanStatus.ACTIVE, null);
            });
            recordOutcome("success");
            log.info("Plan {} generated in {} ms", planId, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
        } catch (TimeoutException e) {
            log.warn("Story generation for plan {} timed out after {}", planId, planProperties.getGenerationTimeout());
            markFailed(planId, TIMEOUT_REASON);
            recordOutcome(TIMEOUT_REASON);
        } catch (Exception e) {
            log.error("Generation of plan {} failed", planId, e);
            markFailed(planId, reasonOf(e));
            recordOutcome("failure");
        } finally {
            lockRegistry.release(studentId, planId);
            try {
                leaseRepository.deleteByPlanId(planId);
            } catch (Exception e) {
                log.error("Failed to delete generation lease of plan {}", planId, e);
            }
        }
    }

    @Override
    public int failStaleGenerations() {
        Instant now = Instant.now(clock);
        List<Plan> stale = planStore.findStaleGeneratingPlans(now.minus(planProperties.getStaleAfter()));
        int failed = 0;
        for (Plan plan : stale) {
            log.warn("Plan {} has been generating since {}, marking it failed", plan.getId(), plan.getCreatedAt());
            if (markFailed(plan.getId(), TIMEOUT_REASON)) {
                failed++;
            }
            leaseRepository.deleteByPlanId(plan.getId());
        }
        int expiredLeases = leaseRepository.deleteExpired(now);
        if (failed > 0 || expiredLeases > 0) {
            log.info("Watchdog failed {} stale plans and removed {} expired leases", failed, expiredLeases);
        }
        return failed;
    }

    private GeneratedStory generateStory(StudentProfile profile, String theme, int dayCount)
            throws TimeoutException {
        CompletableFuture<GeneratedStory> future = CompletableFuture.supplyAsync(
                () -> contentGenerator.generateStory(profile, theme, dayCount), contentGeneratorExecutor);
        try {
            return future.get(planProperties.getGenerationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ContentGenerationException("Story generation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ContentGenerationException("Story generation interrupted", e);
        }
    }

    /**
     * Moves a still GENERATING plan to FAILED. Errors are logged, not thrown.
     *
     * @return true when the plan was marked failed
     */
    private boolean markFailed(UUID planId, String reason) {
        try {
            Boolean updated = transactionTemplate.execute(status -> {
                Plan current = planStore.getPlanForGeneration(planId);
                if (!current.isGenerating()) {
                    log.info("Plan {} is already {}, not marking it failed", planId, current.getStatus());
                    return false;
                }
                planStore.updatePlanStatus(planId, PlanStatus.FAILED, reason);
                return true;
            });
            return Boolean.TRUE.equals(updated);
        } catch (Exception e) {
            log.error("Failed to mark plan {} as FAILED (reason: {})", planId, reason, e);
            return false;
        }
    }

    private void recordOutcome(String outcome) {
        meterRegistry.counter("reading.plan.generation", "outcome", outcome).increment();
    }

    private String reasonOf(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        return message.length() > MAX_REASON_LENGTH ? message.substring(0, MAX_REASON_LENGTH) : message;
    }
}
