package uk.gegc.readingplan.features.activity.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for generated activity content.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "reading.activities")
public class ActivityProperties {

    /**
     * How long generated content stays valid in the cache.
     * Default: 24 hours
     */
    @NotNull
    private Duration cacheTtl = Duration.ofHours(24);

    /**
     * Fixed delay between expired-content purge runs (in seconds).
     * Default: 3600 seconds (1 hour)
     */
    @Min(1)
    private int purgeFixedDelaySeconds = 3600;
}
