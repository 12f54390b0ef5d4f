package uk.gegc.readingplan.features.plan.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationWorker;

/**
 * Fails plans stuck in GENERATING, e.g. because the instance running their task went away,
 * and removes leftover generation leases.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanGenerationWatchdogScheduler {

    private final PlanGenerationWorker planGenerationWorker;

    /**
     * Delay is configurable via reading.plans.watchdog-fixed-delay-seconds.
     * Default: 60 seconds (1 minute)
     */
    @Scheduled(fixedDelayString = "${reading.plans.watchdog-fixed-delay-seconds:60}000")
    public void failStaleGenerations() {
        log.debug("Running scheduled check for stale plan generations");
        try {
            planGenerationWorker.failStaleGenerations();
        } catch (Exception e) {
            log.error("Error during scheduled check for stale plan generations", e);
        }
    }
}
