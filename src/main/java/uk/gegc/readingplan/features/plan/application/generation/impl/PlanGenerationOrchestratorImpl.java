package uk.gegc.readingplan.features.plan.application.generation.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.readingplan.features.plan.api.dto.CreatePlanRequest;
import uk.gegc.readingplan.features.plan.api.dto.PlanCreationResponse;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.application.generation.GenerationLockRegistry;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationOrchestrator;
import uk.gegc.readingplan.features.plan.config.PlanProperties;
import uk.gegc.readingplan.features.plan.domain.events.PlanGenerationRequestedEvent;
import uk.gegc.readingplan.features.plan.domain.model.GenerationLease;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;
import uk.gegc.readingplan.features.plan.domain.repository.GenerationLeaseRepository;
import uk.gegc.readingplan.features.student.application.StudentDirectory;
import uk.gegc.readingplan.features.student.domain.model.Student;
import uk.gegc.readingplan.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for plan creation.
 *
 * <p>Duplicate requests for a student are answered with the plan already being generated.
 * Three guards apply in order: a recent GENERATING plan in storage, the in-memory lock of this
 * instance, and finally the unique durable lease inserted together with the plan stub.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationOrchestratorImpl implements PlanGenerationOrchestrator {

    private final StudentDirectory studentDirectory;
    private final PlanStore planStore;
    private final GenerationLeaseRepository leaseRepository;
    private final GenerationLockRegistry lockRegistry;
    private final PlanProperties planProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public PlanCreationResponse requestPlan(String accountUsername, CreatePlanRequest request) {
        String name = requireText(request.name(), "name", planProperties.getNameMaxLength());
        String theme = requireText(request.theme(), "theme", planProperties.getThemeMaxLength());
        PlanVariant variant = request.variant() != null ? request.variant() : PlanVariant.THREE_DAY;

        Student student = studentDirectory.getOwnedStudent(request.studentId(), accountUsername);
        Long studentId = student.getId();
        Instant now = Instant.now(clock);
        int estimatedSeconds = planProperties.getEstimatedGenerationSeconds();

        Optional<Plan> recent = planStore.findRecentGeneratingPlan(studentId, now.minus(planProperties.getDuplicateWindow()));
        if (recent.isPresent()) {
            log.info("Student {} already has plan {} generating, returning it", studentId, recent.get().getId());
            return PlanCreationResponse.inProgress(recent.get().getId(), estimatedSeconds);
        }

        Optional<UUID> lockedPlan = lockRegistry.holder(studentId);
        if (lockedPlan.isPresent()) {
            log.info("Generation lock for student {} is held by plan {}", studentId, lockedPlan.get());
            return PlanCreationResponse.inProgress(lockedPlan.get(), estimatedSeconds);
        }

        try {
            return transactionTemplate.execute(status -> {
                leaseRepository.deleteExpiredForStudent(studentId, now);
                Plan plan = planStore.createPlanStub(student, name, theme, variant);
                leaseRepository.saveAndFlush(new GenerationLease(
                        studentId, plan.getId(), now, now.plus(planProperties.getLeaseTtl())));

                log.info("Plan {} ({}) created for student {}, scheduling generation", plan.getId(), variant.getValue(), studentId);
                applicationEventPublisher.publishEvent(new PlanGenerationRequestedEvent(this, plan.getId(), studentId));
                return PlanCreationResponse.started(plan.getId(), variant, estimatedSeconds);
            });
        } catch (DataIntegrityViolationException e) {
            log.info("Lost lease race for student {}; looking up the winning plan", studentId);
            return leaseRepository.findByStudentId(studentId)
                    .map(lease -> PlanCreationResponse.inProgress(lease.getPlanId(), estimatedSeconds))
                    .orElseThrow(() -> e);
        }
    }

    private String requireText(String value, String field, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            throw new ValidationException(field + " must not exceed " + maxLength + " characters");
        }
        return trimmed;
    }
}
