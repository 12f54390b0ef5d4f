package uk.gegc.readingplan.features.plan.domain.model;

import jakarta.persistence.CascadeType;
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
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.readingplan.features.student.domain.model.Student;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A student's multi-day reading plan. Created as a GENERATING stub and filled in by the
 * deferred generation task; after that only its status changes.
 *
 * <p>{@code failureReason} is diagnostic text set together with {@link PlanStatus#FAILED};
 * it never replaces the user-facing {@code name} or {@code theme}.
 */
@Entity
@Table(name = "reading_plans")
@Getter
@Setter
@NoArgsConstructor
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false)
    private Student student;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "theme", nullable = false, length = 50)
    private String theme;

    @Enumerated(EnumType.STRING)
    @Column(name = "variant", nullable = false, length = 20)
    private PlanVariant variant;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PlanStatus status;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @OneToOne(mappedBy = "plan", cascade = CascadeType.ALL, orphanRemoval = true)
    private Story story;

    @OneToMany(mappedBy = "plan", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("dayIndex ASC")
    private List<PlanDay> days = new ArrayList<>();

    @Version
    @Column(name = "version")
    private Long version;

    public static Plan stub(Student student, String name, String theme, PlanVariant variant, Instant now) {
        Plan plan = new Plan();
        plan.student = student;
        plan.name = name;
        plan.theme = theme;
        plan.variant = variant;
        plan.status = PlanStatus.GENERATING;
        plan.createdAt = now;
        plan.updatedAt = now;
        return plan;
    }

    public void attachStory(Story story) {
        story.setPlan(this);
        this.story = story;
    }

    public void addDay(PlanDay day) {
        day.setPlan(this);
        this.days.add(day);
    }

    public int getDayCount() {
        return variant.getDayCount();
    }

    public Optional<PlanDay> findDay(int dayIndex) {
        return days.stream()
                .filter(day -> day.getDayIndex() == dayIndex)
                .findFirst();
    }

    /**
     * Mark the plan as ready for reading once story and days are persisted
     */
    public void markActive(Instant now) {
        if (status != PlanStatus.GENERATING) {
            throw new IllegalStateException("Plan " + id + " cannot become active from status " + status);
        }
        this.status = PlanStatus.ACTIVE;
        this.failureReason = null;
        this.updatedAt = now;
    }

    /**
     * Mark the plan as failed, keeping the reason apart from user-facing fields
     */
    public void markFailed(String reason, Instant now) {
        this.status = PlanStatus.FAILED;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    public void markCompleted(Instant now) {
        this.status = PlanStatus.COMPLETED;
        this.completedAt = now;
        this.updatedAt = now;
    }

    public boolean isGenerating() {
        return status == PlanStatus.GENERATING;
    }
}
