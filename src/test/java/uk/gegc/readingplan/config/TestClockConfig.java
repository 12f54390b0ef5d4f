package uk.gegc.readingplan.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Fixed Clock for tests so durations and timestamps are predictable.
 */
@TestConfiguration
@Profile("test")
public class TestClockConfig {

    /**
     * Fixed instant for testing - January 1, 2024, 12:00:00 UTC
     */
    private static final Instant FIXED_INSTANT = Instant.parse("2024-01-01T12:00:00Z");

    @Bean
    @Primary
    @Profile("test")
    public Clock testClock() {
        return Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC"));
    }

    public static Instant getFixedInstant() {
        return FIXED_INSTANT;
    }
}
