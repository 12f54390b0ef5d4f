package uk.gegc.readingplan.features.plan.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable marker that a student has a plan generation in flight. The unique constraint on
 * {@code student_id} guarantees at most one lease per student across all running instances.
 */
@Entity
@Table(name = "generation_leases", uniqueConstraints = {
        @UniqueConstraint(name = "uk_generation_leases_student", columnNames = "student_id")
})
@Getter
@Setter
@NoArgsConstructor
public class GenerationLease {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public GenerationLease(Long studentId, UUID planId, Instant acquiredAt, Instant expiresAt) {
        this.studentId = studentId;
        this.planId = planId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
