package uk.gegc.readingplan.features.plan.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.readingplan.features.plan.api.dto.AnswerSubmissionResponse;
import uk.gegc.readingplan.features.plan.api.dto.CreatePlanRequest;
import uk.gegc.readingplan.features.plan.api.dto.PlanCreationResponse;
import uk.gegc.readingplan.features.plan.api.dto.PlanStatusResponse;
import uk.gegc.readingplan.features.plan.application.DayProgressionService;
import uk.gegc.readingplan.features.plan.application.PlanQueryService;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationOrchestrator;
import uk.gegc.readingplan.features.plan.domain.model.DayState;
import uk.gegc.readingplan.features.plan.domain.model.PlanStatus;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;
import uk.gegc.readingplan.shared.api.problem.ErrorCode;
import uk.gegc.readingplan.shared.exception.ActivitiesIncompleteException;
import uk.gegc.readingplan.shared.exception.PlanStateException;
import uk.gegc.readingplan.shared.exception.ResourceNotFoundException;
import uk.gegc.readingplan.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanController.class)
@Import(WebMvcSecurityTestConfig.class)
@ActiveProfiles("test")
@DisplayName("PlanController")
class PlanControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockitoBean
    PlanGenerationOrchestrator planGenerationOrchestrator;

    @MockitoBean
    PlanQueryService planQueryService;

    @MockitoBean
    DayProgressionService dayProgressionService;

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST /api/v1/plans: when request is valid then returns 201 with the generating plan")
    void createPlan_whenValid_thenCreated() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(planGenerationOrchestrator.requestPlan(eq("parent"), any(CreatePlanRequest.class)))
                .thenReturn(PlanCreationResponse.started(planId, PlanVariant.THREE_DAY, 60));
        CreatePlanRequest request = new CreatePlanRequest(42L, "Summer Adventures", "space", PlanVariant.THREE_DAY);

        // When / Then
        mockMvc.perform(post("/api/v1/plans")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("3-day plan generation started"))
                .andExpect(jsonPath("$.plan.id").value(planId.toString()))
                .andExpect(jsonPath("$.plan.status").value("generating"))
                .andExpect(jsonPath("$.estimatedCompletionSeconds").value(60))
                .andExpect(jsonPath("$.alreadyInProgress").doesNotExist());
    }

    @Test
    @DisplayName("POST /api/v1/plans: when unauthenticated then returns 401")
    void createPlan_whenUnauthenticated_thenUnauthorized() throws Exception {
        // Given
        CreatePlanRequest request = new CreatePlanRequest(42L, "Summer Adventures", "space", PlanVariant.THREE_DAY);

        // When / Then
        mockMvc.perform(post("/api/v1/plans")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.instance").value("/api/v1/plans"));

        verify(planGenerationOrchestrator, never()).requestPlan(anyString(), any());
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST /api/v1/plans: when name is blank then returns 400 with field errors")
    void createPlan_whenNameBlank_thenBadRequest() throws Exception {
        // Given
        String body = """
                {"studentId":42,"name":"  ","theme":"space","variant":"3-day"}
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/plans")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors").exists());

        verify(planGenerationOrchestrator, never()).requestPlan(anyString(), any());
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST /api/v1/plans: when variant is unknown then returns 400")
    void createPlan_whenVariantUnknown_thenBadRequest() throws Exception {
        // Given
        String body = """
                {"studentId":42,"name":"Summer","theme":"space","variant":"7-day"}
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/plans")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST /api/v1/plans: when student is unknown then returns 404")
    void createPlan_whenStudentUnknown_thenNotFound() throws Exception {
        // Given
        when(planGenerationOrchestrator.requestPlan(eq("parent"), any(CreatePlanRequest.class)))
                .thenThrow(new ResourceNotFoundException(ErrorCode.STUDENT_NOT_FOUND, "Student 42 not found"));
        CreatePlanRequest request = new CreatePlanRequest(42L, "Summer Adventures", "space", null);

        // When / Then
        mockMvc.perform(post("/api/v1/plans")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("STUDENT_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Student 42 not found"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("GET /api/v1/plans/status/{id}: when plan is generating then returns status and estimate")
    void getStatus_whenGenerating_thenOk() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(planQueryService.getStatus(planId, "parent"))
                .thenReturn(new PlanStatusResponse(planId, PlanStatus.GENERATING, 45, null, Instant.parse("2024-01-01T12:00:00Z")));

        // When / Then
        mockMvc.perform(get("/api/v1/plans/status/{planId}", planId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.planId").value(planId.toString()))
                .andExpect(jsonPath("$.status").value("generating"))
                .andExpect(jsonPath("$.estimatedCompletionSeconds").value(45))
                .andExpect(jsonPath("$.failureReason").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/v1/plans/status/{id}: when bearer token is valid then resolves the account from its subject")
    void getStatus_whenBearerToken_thenAuthenticatedAsSubject() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(planQueryService.getStatus(planId, "parent"))
                .thenReturn(new PlanStatusResponse(planId, PlanStatus.ACTIVE, null, null, Instant.parse("2024-01-01T12:00:00Z")));

        // When / Then
        mockMvc.perform(get("/api/v1/plans/status/{planId}", planId)
                        .header(HttpHeaders.AUTHORIZATION, WebMvcSecurityTestConfig.bearerToken("parent")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("active"));
    }

    @Test
    @DisplayName("GET /api/v1/plans/status/{id}: when bearer token is malformed then returns 401")
    void getStatus_whenBearerTokenMalformed_thenUnauthorized() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/v1/plans/status/{planId}", UUID.randomUUID())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        verify(planQueryService, never()).getStatus(any(), anyString());
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("GET /api/v1/plans/{id}: when plan is not visible then returns 404")
    void getPlan_whenNotVisible_thenNotFound() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(planQueryService.getPlan(planId, "parent"))
                .thenThrow(new ResourceNotFoundException(ErrorCode.PLAN_NOT_FOUND, "Plan not found"));

        // When / Then
        mockMvc.perform(get("/api/v1/plans/{planId}", planId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("PLAN_NOT_FOUND"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("GET /api/v1/plans/{id}: when id is not a UUID then returns 400")
    void getPlan_whenIdMalformed_thenBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/plans/{planId}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("GET /api/v1/plans/{id}/day/{n}: when day is locked then returns 400 DAY_LOCKED")
    void getDay_whenLocked_thenBadRequest() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(planQueryService.getDay(planId, 2, "parent"))
                .thenThrow(new PlanStateException(ErrorCode.DAY_LOCKED, "Day 2 is locked"));

        // When / Then
        mockMvc.perform(get("/api/v1/plans/{planId}/day/{dayIndex}", planId, 2))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DAY_LOCKED"))
                .andExpect(jsonPath("$.message").value("Day 2 is locked"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST answers: when day completes then returns the unlocked next day")
    void submitAnswers_whenDayCompletes_thenOk() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        UUID dayId = UUID.randomUUID();
        AnswerSubmissionResponse response = new AnswerSubmissionResponse(
                "Day 1 completed successfully",
                new AnswerSubmissionResponse.AnsweredDay(dayId, 1, DayState.COMPLETE,
                        Instant.parse("2024-01-01T12:30:00Z"), Map.of("where", "In a big forest")),
                2,
                false
        );
        when(dayProgressionService.submitAnswers(eq(planId), eq(1), any(), eq("parent"))).thenReturn(response);
        String body = """
                {"answers":{"where":"In a big forest"},"completeDay":true}
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/plans/{planId}/day/{dayIndex}/answers", planId, 1)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Day 1 completed successfully"))
                .andExpect(jsonPath("$.day.state").value("complete"))
                .andExpect(jsonPath("$.nextDayUnlocked").value(2))
                .andExpect(jsonPath("$.planComplete").value(false));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST answers: when required activities fail then returns 400 with failed activities")
    void submitAnswers_whenActivitiesIncomplete_thenBadRequestWithFailures() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        Map<String, String> failed = new LinkedHashMap<>();
        failed.put("where", "Answer is too short");
        failed.put("sequence", "Not answered");
        when(dayProgressionService.submitAnswers(eq(planId), eq(1), any(), eq("parent")))
                .thenThrow(new ActivitiesIncompleteException(failed));
        String body = """
                {"answers":{"where":"x"},"completeDay":true}
                """;

        // When / Then
        mockMvc.perform(post("/api/v1/plans/{planId}/day/{dayIndex}/answers", planId, 1)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ACTIVITIES_INCOMPLETE"))
                .andExpect(jsonPath("$.failedActivities.where").value("Answer is too short"))
                .andExpect(jsonPath("$.failedActivities.sequence").value("Not answered"));
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST answers: when answers are missing then returns 400 without calling the service")
    void submitAnswers_whenAnswersMissing_thenBadRequest() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();

        // When / Then
        mockMvc.perform(post("/api/v1/plans/{planId}/day/{dayIndex}/answers", planId, 1)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"completeDay\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verify(dayProgressionService, never()).submitAnswers(any(), anyInt(), any(), anyString());
    }

    @Test
    @WithMockUser(username = "parent")
    @DisplayName("POST answers: when day is already complete then returns 400 DAY_ALREADY_COMPLETE")
    void submitAnswers_whenAlreadyComplete_thenBadRequest() throws Exception {
        // Given
        UUID planId = UUID.randomUUID();
        when(dayProgressionService.submitAnswers(eq(planId), eq(1), any(), eq("parent")))
                .thenThrow(new PlanStateException(ErrorCode.DAY_ALREADY_COMPLETE, "Day 1 is already complete"));

        // When / Then
        mockMvc.perform(post("/api/v1/plans/{planId}/day/{dayIndex}/answers", planId, 1)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{},\"completeDay\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DAY_ALREADY_COMPLETE"));
    }
}
