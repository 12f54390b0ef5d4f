package uk.gegc.readingplan.features.plan.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Generated narrative of a plan, one chapter per day. Never modified after creation.
 */
@Entity
@Table(name = "plan_stories")
@Getter
@Setter
@NoArgsConstructor
public class Story {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "plan_id", nullable = false, unique = true)
    private Plan plan;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "themes")
    private List<String> themes = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "chapters", nullable = false)
    private List<String> chapters = new ArrayList<>();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Story(String title, List<String> themes, List<String> chapters, Instant createdAt) {
        this.title = title;
        this.themes = new ArrayList<>(themes);
        this.chapters = new ArrayList<>(chapters);
        this.createdAt = createdAt;
    }

    /**
     * Chapter text for a 1-based day index, or an empty string when absent
     */
    public String chapter(int dayIndex) {
        if (chapters == null || dayIndex < 1 || dayIndex > chapters.size()) {
            return "";
        }
        String text = chapters.get(dayIndex - 1);
        return text != null ? text : "";
    }
}
