package uk.gegc.readingplan.features.plan.application;

import uk.gegc.readingplan.features.plan.api.dto.AnswerSubmissionResponse;
import uk.gegc.readingplan.features.plan.api.dto.SubmitAnswersRequest;

import java.util.UUID;

/**
 * Day state machine: LOCKED, then AVAILABLE, then COMPLETE. Answers drive the transitions.
 */
public interface DayProgressionService {

    /**
     * Saves answers for a day and, when requested, completes it.
     *
     * <p>Completion requires every required activity of the day to validate against the merged
     * answers; otherwise nothing is saved and the failing activities are reported. Completing
     * day i unlocks day i+1, and completing the last day completes the plan.
     */
    AnswerSubmissionResponse submitAnswers(UUID planId, int dayIndex, SubmitAnswersRequest request, String accountUsername);
}
