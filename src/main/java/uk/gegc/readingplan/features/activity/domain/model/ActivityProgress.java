package uk.gegc.readingplan.features.activity.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "activity_progress", uniqueConstraints = {
        @UniqueConstraint(name = "uk_activity_progress_key",
                columnNames = {"student_id", "plan_id", "day_index", "activity_type"})
})
@Getter
@Setter
@NoArgsConstructor
public class ActivityProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    @Column(name = "day_index", nullable = false)
    private int dayIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 20)
    private ActivityType activityType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ActivityProgressStatus status = ActivityProgressStatus.NOT_STARTED;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "time_spent_seconds", nullable = false)
    private int timeSpentSeconds;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Version
    @Column(name = "version")
    private Long version;

    public ActivityProgress(Long studentId, UUID planId, int dayIndex, ActivityType activityType) {
        this.studentId = studentId;
        this.planId = planId;
        this.dayIndex = dayIndex;
        this.activityType = activityType;
    }

    /**
     * Applies a status report. Every report of COMPLETED counts as one attempt.
     */
    public void record(ActivityProgressStatus newStatus, Integer timeSpent, Instant now) {
        this.status = newStatus;
        if (timeSpent != null) {
            this.timeSpentSeconds = timeSpent;
        }
        if (newStatus != ActivityProgressStatus.NOT_STARTED && startedAt == null) {
            this.startedAt = now;
        }
        if (newStatus == ActivityProgressStatus.COMPLETED) {
            this.completedAt = now;
            this.attempts++;
        }
    }
}
