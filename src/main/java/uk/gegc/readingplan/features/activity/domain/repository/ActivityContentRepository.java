package uk.gegc.readingplan.features.activity.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.readingplan.features.activity.domain.model.ActivityContent;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActivityContentRepository extends JpaRepository<ActivityContent, UUID> {

    Optional<ActivityContent> findByPlanIdAndDayIndexAndActivityType(UUID planId, int dayIndex, ActivityType activityType);

    @Transactional
    @Modifying
    @Query("delete from ActivityContent c where c.planId = :planId and c.dayIndex = :dayIndex")
    int deleteByPlanIdAndDayIndex(@Param("planId") UUID planId, @Param("dayIndex") int dayIndex);

    @Transactional
    @Modifying
    @Query("delete from ActivityContent c where c.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
