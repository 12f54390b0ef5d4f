package uk.gegc.readingplan.features.plan.application.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationWorker;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanGenerationWatchdogScheduler Tests")
class PlanGenerationWatchdogSchedulerTest {

    @Mock
    private PlanGenerationWorker planGenerationWorker;

    @InjectMocks
    private PlanGenerationWatchdogScheduler scheduler;

    @Test
    @DisplayName("failStaleGenerations: delegates to the worker")
    void failStaleGenerations_delegates() {
        // Given
        when(planGenerationWorker.failStaleGenerations()).thenReturn(1);

        // When
        scheduler.failStaleGenerations();

        // Then
        verify(planGenerationWorker).failStaleGenerations();
    }

    @Test
    @DisplayName("failStaleGenerations: when the worker throws then error is logged and not rethrown")
    void failStaleGenerations_failure_thenNotRethrown() {
        // Given
        when(planGenerationWorker.failStaleGenerations()).thenThrow(new RuntimeException("database unavailable"));

        // When / Then
        assertThatCode(() -> scheduler.failStaleGenerations()).doesNotThrowAnyException();
    }
}
