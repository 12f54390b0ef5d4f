package uk.gegc.readingplan.features.plan.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.readingplan.features.plan.api.dto.*;
import uk.gegc.readingplan.features.plan.application.DayProgressionService;
import uk.gegc.readingplan.features.plan.application.PlanQueryService;
import uk.gegc.readingplan.features.plan.application.generation.PlanGenerationOrchestrator;

import java.util.UUID;

@Tag(name = "Reading Plans", description = "Create reading plans, read days and submit answers")
@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
@Validated
public class PlanController {

    private final PlanGenerationOrchestrator planGenerationOrchestrator;
    private final PlanQueryService planQueryService;
    private final DayProgressionService dayProgressionService;

    @Operation(
            summary = "Create a reading plan",
            description = "Starts story generation in the background and returns immediately. "
                    + "A repeated request while generation is running returns the plan already being generated."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Generation started or already in progress",
                    content = @Content(schema = @Schema(implementation = PlanCreationResponse.class),
                            examples = @ExampleObject(name = "started", value = """
                                    {
                                      "message":"3-day plan generation started",
                                      "plan":{"id":"3fa85f64-5717-4562-b3fc-2c963f66afa6","status":"generating"},
                                      "estimatedCompletionSeconds":60
                                    }
                                    """))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Student not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<PlanCreationResponse> createPlan(
            @RequestBody @Valid CreatePlanRequest request,
            Authentication authentication
    ) {
        PlanCreationResponse response = planGenerationOrchestrator.requestPlan(authentication.getName(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Get a plan with its days and progress")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan returned",
                    content = @Content(schema = @Schema(implementation = PlanDetailsResponse.class))),
            @ApiResponse(responseCode = "404", description = "Plan not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{planId}")
    public ResponseEntity<PlanDetailsResponse> getPlan(
            @Parameter(description = "Plan UUID", required = true) @PathVariable UUID planId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(planQueryService.getPlan(planId, authentication.getName()));
    }

    @Operation(
            summary = "Get one day of a plan",
            description = "Returns the chapter, the day's activities with their content and the saved answers. "
                    + "Locked days cannot be read."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Day returned",
                    content = @Content(schema = @Schema(implementation = DayDetailResponse.class))),
            @ApiResponse(responseCode = "400", description = "Day locked or index out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Plan or day not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{planId}/day/{dayIndex}")
    public ResponseEntity<DayDetailResponse> getDay(
            @PathVariable UUID planId,
            @Parameter(description = "Day index (1-based)") @PathVariable @Min(1) int dayIndex,
            Authentication authentication
    ) {
        return ResponseEntity.ok(planQueryService.getDay(planId, dayIndex, authentication.getName()));
    }

    @Operation(
            summary = "Submit answers for a day",
            description = "Saves answers. With completeDay=true every required activity must be answered correctly; "
                    + "the day is then completed and the next day unlocked."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answers saved",
                    content = @Content(schema = @Schema(implementation = AnswerSubmissionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid answers, day locked, already complete or activities incomplete",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent update, retry",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{planId}/day/{dayIndex}/answers")
    public ResponseEntity<AnswerSubmissionResponse> submitAnswers(
            @PathVariable UUID planId,
            @PathVariable @Min(1) int dayIndex,
            @RequestBody @Valid SubmitAnswersRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(dayProgressionService.submitAnswers(planId, dayIndex, request, authentication.getName()));
    }

    @Operation(summary = "Poll the generation status of a plan")
    @GetMapping("/status/{planId}")
    public ResponseEntity<PlanStatusResponse> getStatus(
            @PathVariable UUID planId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(planQueryService.getStatus(planId, authentication.getName()));
    }

    @Operation(summary = "Get the latest plan of a student")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan returned",
                    content = @Content(schema = @Schema(implementation = PlanDetailsResponse.class))),
            @ApiResponse(responseCode = "404", description = "Student or plan not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/student/{studentId}")
    public ResponseEntity<PlanDetailsResponse> getLatestForStudent(
            @PathVariable Long studentId,
            Authentication authentication
    ) {
        return ResponseEntity.ok(planQueryService.getLatestPlanForStudent(studentId, authentication.getName()));
    }
}
