package uk.gegc.readingplan.features.activity.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.readingplan.features.activity.domain.model.ActivityProgress;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActivityProgressRepository extends JpaRepository<ActivityProgress, UUID> {

    Optional<ActivityProgress> findByStudentIdAndPlanIdAndDayIndexAndActivityType(
            Long studentId, UUID planId, int dayIndex, ActivityType activityType);

    List<ActivityProgress> findByPlanIdAndDayIndex(UUID planId, int dayIndex);
}
