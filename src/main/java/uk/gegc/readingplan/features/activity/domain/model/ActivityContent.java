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
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Cached generator output for one (plan, day, activity type). Rows are upserted on
 * regeneration and ignored once {@code expiresAt} has passed. Fallback content is never stored.
 */
@Entity
@Table(name = "activity_contents", uniqueConstraints = {
        @UniqueConstraint(name = "uk_activity_contents_key", columnNames = {"plan_id", "day_index", "activity_type"})
})
@Getter
@Setter
@NoArgsConstructor
public class ActivityContent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "plan_id", nullable = false)
    private UUID planId;

    @Column(name = "day_index", nullable = false)
    private int dayIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "activity_type", nullable = false, length = 20)
    private ActivityType activityType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "content", nullable = false)
    private Map<String, Object> content;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "student_age", nullable = false)
    private int studentAge;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ActivityContent(UUID planId, int dayIndex, ActivityType activityType) {
        this.planId = planId;
        this.dayIndex = dayIndex;
        this.activityType = activityType;
    }

    public boolean isFresh(Instant now) {
        return expiresAt != null && now.isBefore(expiresAt);
    }

    public void refresh(Map<String, Object> content, String contentHash, int studentAge, Instant now, Instant expiresAt) {
        this.content = content;
        this.contentHash = contentHash;
        this.studentAge = studentAge;
        this.expiresAt = expiresAt;
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }
}
