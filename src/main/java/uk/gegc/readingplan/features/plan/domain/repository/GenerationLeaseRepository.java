package uk.gegc.readingplan.features.plan.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.plan.domain.model.GenerationLease;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationLeaseRepository extends JpaRepository<GenerationLease, UUID> {

    Optional<GenerationLease> findByStudentId(Long studentId);

    @Transactional
    @Modifying
    @Query("delete from GenerationLease l where l.planId = :planId")
    int deleteByPlanId(@Param("planId") UUID planId);

    @Transactional
    @Modifying
    @Query("delete from GenerationLease l where l.studentId = :studentId and l.expiresAt <= :now")
    int deleteExpiredForStudent(@Param("studentId") Long studentId, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("delete from GenerationLease l where l.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
