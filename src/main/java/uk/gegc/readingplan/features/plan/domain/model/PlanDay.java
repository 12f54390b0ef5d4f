package uk.gegc.readingplan.features.plan.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "plan_days", uniqueConstraints = {
        @UniqueConstraint(name = "uk_plan_days_plan_index", columnNames = {"plan_id", "day_index"})
})
@Getter
@Setter
@NoArgsConstructor
public class PlanDay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "plan_id", nullable = false)
    private Plan plan;

    @Column(name = "day_index", nullable = false)
    private int dayIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private DayState state;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Activity key to the raw response submitted for it
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "answers")
    private Map<String, Object> answers = new LinkedHashMap<>();

    @Version
    @Column(name = "version")
    private Long version;

    public PlanDay(int dayIndex, DayState state) {
        this.dayIndex = dayIndex;
        this.state = state;
    }

    public boolean isLocked() {
        return state == DayState.LOCKED;
    }

    public boolean isComplete() {
        return state == DayState.COMPLETE;
    }

    /**
     * Moves a LOCKED day to AVAILABLE.
     *
     * @return true when the state changed, false when the day was already unlocked
     */
    public boolean unlock() {
        if (state != DayState.LOCKED) {
            return false;
        }
        this.state = DayState.AVAILABLE;
        return true;
    }

    public void complete(Instant now) {
        if (state != DayState.AVAILABLE) {
            throw new IllegalStateException("Day " + dayIndex + " cannot be completed from state " + state);
        }
        this.state = DayState.COMPLETE;
        this.completedAt = now;
    }

    public void mergeAnswers(Map<String, Object> submitted) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (answers != null) {
            merged.putAll(answers);
        }
        merged.putAll(submitted);
        this.answers = merged;
    }
}
