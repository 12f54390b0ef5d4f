package uk.gegc.readingplan.features.plan.domain.events;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a plan stub and its generation lease have been created.
 * Handled after the surrounding transaction commits so the stub is visible to the worker.
 */
public class PlanGenerationRequestedEvent extends ApplicationEvent {

    private final UUID planId;
    private final Long studentId;

    public PlanGenerationRequestedEvent(Object source, UUID planId, Long studentId) {
        super(source);
        this.planId = planId;
        this.studentId = studentId;
    }

    public UUID getPlanId() {
        return planId;
    }

    public Long getStudentId() {
        return studentId;
    }
}
