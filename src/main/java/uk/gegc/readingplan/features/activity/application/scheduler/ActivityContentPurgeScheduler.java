package uk.gegc.readingplan.features.activity.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;

/**
 * Removes expired activity content from the cache table.
 * Expired rows are never served, so this only keeps the table small.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActivityContentPurgeScheduler {

    private final ActivityContentCache contentCache;

    /**
     * Delay is configurable via reading.activities.purge-fixed-delay-seconds.
     * Default: 3600 seconds (1 hour)
     */
    @Scheduled(fixedDelayString = "${reading.activities.purge-fixed-delay-seconds:3600}000")
    public void purgeExpiredContent() {
        log.debug("Running scheduled purge of expired activity content");
        try {
            int removed = contentCache.purgeExpired();
            if (removed > 0) {
                log.info("Purged {} expired activity content entries", removed);
            }
        } catch (Exception e) {
            log.error("Error during scheduled purge of expired activity content", e);
        }
    }
}
