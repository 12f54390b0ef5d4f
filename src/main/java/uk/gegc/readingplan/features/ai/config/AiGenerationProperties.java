package uk.gegc.readingplan.features.ai.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Retry and backoff settings for content generator calls
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "reading.ai")
public class AiGenerationProperties {

    /**
     * Maximum number of attempts per generator call
     */
    @Min(1)
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff on rate limits
     */
    @Min(0)
    private long baseDelayMs = 1000;

    /**
     * Maximum delay in milliseconds (cap for exponential backoff)
     */
    @Min(0)
    private long maxDelayMs = 30000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.25;
}
