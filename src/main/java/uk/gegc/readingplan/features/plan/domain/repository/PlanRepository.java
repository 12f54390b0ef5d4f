package uk.gegc.readingplan.features.plan.domain.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PlanRepository extends JpaRepository<Plan, UUID> {

    @EntityGraph(attributePaths = {"student", "story", "days"})
    Optional<Plan> findByIdAndStudentAccountUsername(UUID id, String accountUsername);

    @EntityGraph(attributePaths = {"student", "story", "days"})
    Optional<Plan> findWithDetailsById(UUID id);

    @EntityGraph(attributePaths = {"student", "story", "days"})
    Optional<Plan> findFirstByStudentIdAndStudentAccountUsernameOrderByCreatedAtDesc(Long studentId, String accountUsername);

    Optional<Plan> findFirstByStudentIdAndStatusAndCreatedAtAfterOrderByCreatedAtDesc(
            Long studentId, PlanStatus status, Instant since);

    List<Plan> findByStatusAndCreatedAtBefore(PlanStatus status, Instant cutoff);
}
