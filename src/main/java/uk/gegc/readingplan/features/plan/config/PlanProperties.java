package uk.gegc.readingplan.features.plan.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for plan creation and the deferred generation task.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "reading.plans")
public class PlanProperties {

    /**
     * A GENERATING plan created within this window is returned instead of starting a new one.
     * Default: 5 minutes
     */
    @NotNull
    private Duration duplicateWindow = Duration.ofMinutes(5);

    /**
     * Upper bound for the story generator call. On expiry the plan fails with reason "timeout".
     * Default: 90 seconds
     */
    @NotNull
    private Duration generationTimeout = Duration.ofSeconds(90);

    /**
     * Lifetime of the durable generation lease. Expired leases are ignored and removed.
     * Default: 10 minutes
     */
    @NotNull
    private Duration leaseTtl = Duration.ofMinutes(10);

    /**
     * GENERATING plans older than this are failed by the watchdog.
     * Default: 10 minutes
     */
    @NotNull
    private Duration staleAfter = Duration.ofMinutes(10);

    /**
     * Fixed delay between watchdog runs (in seconds).
     * Default: 60 seconds
     */
    @Min(1)
    private int watchdogFixedDelaySeconds = 60;

    /**
     * Typical generation time reported to polling clients (in seconds).
     */
    @Min(0)
    private int estimatedGenerationSeconds = 60;

    @Min(1)
    private int nameMaxLength = 100;

    @Min(1)
    private int themeMaxLength = 50;
}
