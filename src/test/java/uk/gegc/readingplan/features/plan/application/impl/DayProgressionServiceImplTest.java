package uk.gegc.readingplan.features.plan.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.readingplan.features.activity.application.ActivityCatalog;
import uk.gegc.readingplan.features.activity.application.ActivityContentCache;
import uk.gegc.readingplan.features.activity.application.ActivityProgressService;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidationContext;
import uk.gegc.readingplan.features.activity.application.validation.AnswerValidator;
import uk.gegc.readingplan.features.activity.domain.model.ActivityType;
import uk.gegc.readingplan.features.activity.infra.rule.MainIdeaAnswerRule;
import uk.gegc.readingplan.features.activity.infra.rule.PredictAnswerRule;
import uk.gegc.readingplan.features.activity.infra.rule.SequenceAnswerRule;
import uk.gegc.readingplan.features.activity.infra.rule.VocabularyAnswerRule;
import uk.gegc.readingplan.features.activity.infra.rule.WhereAnswerRule;
import uk.gegc.readingplan.features.activity.infra.rule.WhoAnswerRule;
import uk.gegc.readingplan.features.plan.api.dto.AnswerSubmissionResponse;
import uk.gegc.readingplan.features.plan.api.dto.SubmitAnswersRequest;
import uk.gegc.readingplan.features.plan.application.PlanStore;
import uk.gegc.readingplan.features.plan.domain.model.DayState;
import uk.gegc.readingplan.features.plan.domain.model.Plan;
import uk.gegc.readingplan.features.plan.domain.model.PlanDay;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;
import uk.gegc.readingplan.features.plan.domain.repository.PlanRepository;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ActivitiesIncompleteException;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ValidationException;
import uk.gegc.readingplan.testsupport.PlanFixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DayProgressionServiceImpl Tests")
class DayProgressionServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final String USER = "parent";

    @Mock
    private PlanStore planStore;

    @Mock
    private PlanRepository planRepository;

    @Mock
    private ActivityContentCache contentCache;

    @Mock
    private ActivityProgressService activityProgressService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DayProgressionServiceImpl service;
    private Plan plan;

    @BeforeEach
    void setUp() {
        AnswerValidator validator = new AnswerValidator(List.of(new WhoAnswerRule(), new WhereAnswerRule(),
                new SequenceAnswerRule(), new MainIdeaAnswerRule(), new VocabularyAnswerRule(), new PredictAnswerRule()));
        service = new DayProgressionServiceImpl(planStore, planRepository, new ActivityCatalog(), validator,
                contentCache, activityProgressService, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        plan = PlanFixtures.activePlan(PlanFixtures.student(7L, USER), PlanVariant.THREE_DAY);
        lenient().when(contentCache.validationContext(any(), anyInt())).thenReturn(AnswerValidationContext.none());
    }

    private JsonNode json(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private Map<String, JsonNode> requiredAnswers() {
        Map<String, JsonNode> answers = new LinkedHashMap<>();
        answers.put("who", json("[\"Mia\",\"Robo\"]"));
        answers.put("where", json("\"In a big forest\""));
        answers.put("sequence", json("[1,2,3,4]"));
        answers.put("mainIdea", json("[0]"));
        answers.put("predict", json("2"));
        return answers;
    }

    @Test
    @DisplayName("submitAnswers: when partial save then stores answers and leaves the day available")
    void submitAnswers_partialSave_thenStoresAnswers() {
        // Given
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(PlanFixtures.day(plan, 1));

        // When
        AnswerSubmissionResponse response = service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(Map.of("where", json("\"In a big forest\"")), null), USER);

        // Then
        assertThat(response.message()).isEqualTo("Answers saved successfully");
        assertThat(response.day().state()).isEqualTo(DayState.AVAILABLE);
        assertThat(response.day().answers()).containsEntry("where", "In a big forest");
        assertThat(response.nextDayUnlocked()).isNull();
        assertThat(response.planComplete()).isFalse();
        verify(activityProgressService).recordAnswerOutcome(7L, plan.getId(), 1, ActivityType.WHERE, true);
        verify(planRepository).flush();
    }

    @Test
    @DisplayName("submitAnswers: when partial save merges with earlier answers then both are kept")
    void submitAnswers_partialSave_thenMergesAnswers() {
        // Given
        PlanDay day = PlanFixtures.day(plan, 1);
        day.mergeAnswers(Map.of("who", List.of("Mia")));
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(day);

        // When
        AnswerSubmissionResponse response = service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(Map.of("predict", json("1")), false), USER);

        // Then
        assertThat(response.day().answers()).containsKeys("who", "predict");
    }

    @Test
    @DisplayName("submitAnswers: when day locked then rejects and stores nothing")
    void submitAnswers_lockedDay_thenRejects() {
        // Given
        PlanDay locked = PlanFixtures.day(plan, 2);
        when(planStore.getDay(plan.getId(), 2, USER)).thenReturn(locked);

        // When / Then
        assertThatThrownBy(() -> service.submitAnswers(plan.getId(), 2,
                new SubmitAnswersRequest(Map.of("predict", json("1")), false), USER))
                .isInstanceOf(PlanStateException.class)
                .satisfies(e -> assertThat(((PlanStateException) e).getErrorCode()).isEqualTo(ErrorCode.DAY_LOCKED));
        assertThat(locked.getAnswers()).isEmpty();
        verifyNoInteractions(activityProgressService);
    }

    @Test
    @DisplayName("submitAnswers: when completing an already complete day then conflict")
    void submitAnswers_alreadyComplete_thenConflict() {
        // Given
        PlanDay day = PlanFixtures.day(plan, 1);
        day.complete(NOW.minusSeconds(600));
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(day);

        // When / Then
        assertThatThrownBy(() -> service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(requiredAnswers(), true), USER))
                .isInstanceOf(PlanStateException.class)
                .satisfies(e -> assertThat(((PlanStateException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DAY_ALREADY_COMPLETE));
    }

    @Test
    @DisplayName("submitAnswers: when required activities fail then lists them and changes nothing")
    void submitAnswers_incompleteActivities_thenNothingPersisted() {
        // Given
        PlanDay day = PlanFixtures.day(plan, 1);
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(day);
        Map<String, JsonNode> answers = requiredAnswers();
        answers.put("where", json("\"forest\""));
        answers.remove("predict");

        // When / Then
        assertThatThrownBy(() -> service.submitAnswers(plan.getId(), 1, new SubmitAnswersRequest(answers, true), USER))
                .isInstanceOf(ActivitiesIncompleteException.class)
                .satisfies(e -> assertThat(((ActivitiesIncompleteException) e).getFailedActivities())
                        .containsOnlyKeys("where", "predict"));
        assertThat(day.getState()).isEqualTo(DayState.AVAILABLE);
        assertThat(day.getAnswers()).isEmpty();
        assertThat(PlanFixtures.day(plan, 2).getState()).isEqualTo(DayState.LOCKED);
        verifyNoInteractions(activityProgressService);
        verify(planRepository, never()).flush();
    }

    @Test
    @DisplayName("submitAnswers: when all required activities valid then completes and unlocks the next day")
    void submitAnswers_completeDay_thenUnlocksNext() {
        // Given
        PlanDay day = PlanFixtures.day(plan, 1);
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(day);

        // When
        AnswerSubmissionResponse response = service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(requiredAnswers(), true), USER);

        // Then
        assertThat(response.message()).isEqualTo("Day 1 completed successfully");
        assertThat(response.day().state()).isEqualTo(DayState.COMPLETE);
        assertThat(response.day().completedAt()).isEqualTo(NOW);
        assertThat(response.nextDayUnlocked()).isEqualTo(2);
        assertThat(response.planComplete()).isFalse();
        assertThat(PlanFixtures.day(plan, 2).getState()).isEqualTo(DayState.AVAILABLE);
        assertThat(PlanFixtures.day(plan, 3).getState()).isEqualTo(DayState.LOCKED);
        verify(activityProgressService).recordAnswerOutcome(7L, plan.getId(), 1, ActivityType.MAIN_IDEA, true);
        verify(planStore, never()).updatePlanStatus(any(), any(), any());
    }

    @Test
    @DisplayName("submitAnswers: when earlier saved answers cover the rest then completion succeeds")
    void submitAnswers_completeWithStoredAnswers_thenSucceeds() {
        // Given
        PlanDay day = PlanFixtures.day(plan, 1);
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("who", List.of("Mia"));
        stored.put("where", "In a big forest");
        stored.put("sequence", List.of(1, 2, 3, 4));
        stored.put("main-idea", List.of(0));
        day.mergeAnswers(stored);
        when(planStore.getDay(plan.getId(), 1, USER)).thenReturn(day);

        // When
        AnswerSubmissionResponse response = service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(Map.of("predict", json("3")), true), USER);

        // Then
        assertThat(response.day().state()).isEqualTo(DayState.COMPLETE);
        assertThat(response.day().answers()).containsKeys("who", "where", "sequence", "main-idea", "predict");
    }

    @Test
    @DisplayName("submitAnswers: when the last day completes then the plan completes")
    void submitAnswers_lastDay_thenPlanComplete() {
        // Given
        PlanFixtures.day(plan, 1).complete(NOW.minusSeconds(7200));
        PlanFixtures.day(plan, 2).unlock();
        PlanFixtures.day(plan, 2).complete(NOW.minusSeconds(3600));
        PlanDay last = PlanFixtures.day(plan, 3);
        last.unlock();
        when(planStore.getDay(plan.getId(), 3, USER)).thenReturn(last);

        // When
        AnswerSubmissionResponse response = service.submitAnswers(plan.getId(), 3,
                new SubmitAnswersRequest(requiredAnswers(), true), USER);

        // Then
        assertThat(response.planComplete()).isTrue();
        assertThat(response.nextDayUnlocked()).isNull();
        verify(planStore).updatePlanStatus(plan.getId(), PlanStatus.COMPLETED, null);
    }

    @Test
    @DisplayName("submitAnswers: five-day plans also require vocabulary")
    void submitAnswers_fiveDayWithoutVocabulary_thenIncomplete() {
        // Given
        Plan fiveDay = PlanFixtures.activePlan(PlanFixtures.student(7L, USER), PlanVariant.FIVE_DAY);
        when(planStore.getDay(fiveDay.getId(), 1, USER)).thenReturn(PlanFixtures.day(fiveDay, 1));

        // When / Then
        assertThatThrownBy(() -> service.submitAnswers(fiveDay.getId(), 1,
                new SubmitAnswersRequest(requiredAnswers(), true), USER))
                .isInstanceOf(ActivitiesIncompleteException.class)
                .satisfies(e -> assertThat(((ActivitiesIncompleteException) e).getFailedActivities())
                        .containsOnlyKeys("vocabulary"));
    }

    @Test
    @DisplayName("submitAnswers: when an answer key is unknown then invalid answers")
    void submitAnswers_unknownKey_thenInvalidAnswers() {
        assertThatThrownBy(() -> service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(Map.of("spelling", json("\"cat\"")), false), USER))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_ANSWERS));
        verifyNoInteractions(planStore);
    }

    @Test
    @DisplayName("submitAnswers: when no answers and no completion then invalid answers")
    void submitAnswers_emptyWithoutCompletion_thenInvalidAnswers() {
        assertThatThrownBy(() -> service.submitAnswers(plan.getId(), 1,
                new SubmitAnswersRequest(Map.of(), false), USER))
                .isInstanceOf(ValidationException.class)
                .hasMessage("At least one answer is required");
        verify(activityProgressService, never())
                .recordAnswerOutcome(anyLong(), any(), anyInt(), any(), anyBoolean());
        verify(planStore, never()).getDay(any(), eq(1), any());
    }
}
