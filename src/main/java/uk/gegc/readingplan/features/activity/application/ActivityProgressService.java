package uk.gegc.readingplan.features.activity.application;

import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressDto;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressUpdateRequest;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;

import java.util.Map;
import java.util.UUID;

public interface ActivityProgressService {

    ActivityProgressDto updateProgress(String accountUsername, ActivityProgressUpdateRequest request);

    Map<String, ActivityProgressDto> getDayProgress(UUID planId, int dayIndex, String accountUsername);

    /**
     * Progress of a day whose plan ownership was already checked by the caller.
     */
    Map<String, ActivityProgressDto> findDayProgress(UUID planId, int dayIndex);

    /**
     * Keeps progress in step with submitted answers. Runs inside the caller's transaction.
     * A valid answer counts an attempt only when the row first becomes COMPLETED, so repeated
     * autosaves of the same answer do not inflate it.
     */
    void recordAnswerOutcome(Long studentId, UUID planId, int dayIndex, ActivityType type, boolean completed);
}
