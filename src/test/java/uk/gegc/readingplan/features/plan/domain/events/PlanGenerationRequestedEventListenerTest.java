package uk.gegc.readingplan.features.plan.domain.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationWorker;

import java.util.UUID;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("PlanGenerationRequestedEventListener Tests")
class PlanGenerationRequestedEventListenerTest {

    @Mock
    private PlanGenerationWorker planGenerationWorker;

    @InjectMocks
    private PlanGenerationRequestedEventListener listener;

    @Test
    @DisplayName("handlePlanGenerationRequest: runs generation for the event's plan")
    void handlePlanGenerationRequest_runsWorker() {
        // Given
        UUID planId = UUID.randomUUID();

        // When
        listener.handlePlanGenerationRequest(new PlanGenerationRequestedEvent(this, planId, 7L));

        // Then
        verify(planGenerationWorker).generate(planId);
    }
}
