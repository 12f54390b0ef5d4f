package uk.gegc.readingplan.features.plan.domain.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationWorker;

/**
 * Starts the deferred generation task for a plan once the creating transaction has committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationRequestedEventListener {

    private final PlanGenerationWorker planGenerationWorker;

    @Async("planGenerationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handlePlanGenerationRequest(PlanGenerationRequestedEvent event) {
        log.debug("Received PlanGenerationRequestedEvent for plan {} (student {})",
                event.getPlanId(), event.getStudentId());
        planGenerationWorker.generate(event.getPlanId());
    }
}
