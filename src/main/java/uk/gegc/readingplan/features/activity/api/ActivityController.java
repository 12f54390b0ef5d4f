package uk.gegc.readingplan.features.activity.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressDto;
import uk.gegc.readingplan.features.activity.api.dto.ActivityProgressUpdateRequest;
import uk.gegc.readingplan.features.activity.api.dto.RegeneratedActivityResponse;
import uk.gegc.readingplan.features.activity.application.ActivityProgressService;
import uk.gegc.readingplan.features.activity.application.ActivityService;

import java.util.Map;
import java.util.UUID;

@Tag(name = "Activities", description = "Regenerate activity content and track activity progress")
@RestController
@RequestMapping("/api/v1/activities")
@RequiredArgsConstructor
@Validated
public class ActivityController {

    private final ActivityService activityService;
    private final ActivityProgressService activityProgressService;

    @Operation(
            summary = "Regenerate activity content",
            description = "Generates fresh content for one activity of an unlocked day and replaces the cached entry."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Content regenerated",
                    content = @Content(schema = @Schema(implementation = RegeneratedActivityResponse.class))),
            @ApiResponse(responseCode = "400", description = "Unknown activity type or day locked",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Plan or day not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Content generator unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/regenerate/{planId}/{dayIndex}/{activityType}")
    public ResponseEntity<RegeneratedActivityResponse> regenerate(
            @Parameter(description = "Plan UUID", required = true) @PathVariable UUID planId,
            @Parameter(description = "Day index (1-based)", required = true) @PathVariable @Min(1) int dayIndex,
            @Parameter(description = "Activity key, e.g. who or main-idea", required = true) @PathVariable String activityType,
            Authentication authentication
    ) {
        return ResponseEntity.ok(activityService.regenerate(planId, dayIndex, activityType, authentication.getName()));
    }

    @Operation(summary = "Clear cached content of a day")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Cache cleared"),
            @ApiResponse(responseCode = "404", description = "Plan or day not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/cache/{planId}/{dayIndex}")
    public ResponseEntity<Void> clearCache(
            @PathVariable UUID planId,
            @PathVariable @Min(1) int dayIndex,
            Authentication authentication
    ) {
        activityService.clearDayCache(planId, dayIndex, authentication.getName());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Report activity progress", description = "Records status and time spent for one activity.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Progress recorded",
                    content = @Content(schema = @Schema(implementation = ActivityProgressDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or day locked",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/progress")
    public ResponseEntity<ActivityProgressDto> updateProgress(
            @RequestBody @Valid ActivityProgressUpdateRequest request,
            Authentication authentication
    ) {
        return ResponseEntity.ok(activityProgressService.updateProgress(authentication.getName(), request));
    }

    @Operation(summary = "Get activity progress of a day")
    @GetMapping("/progress/{planId}/{dayIndex}")
    public ResponseEntity<Map<String, ActivityProgressDto>> getProgress(
            @PathVariable UUID planId,
            @PathVariable @Min(1) int dayIndex,
            Authentication authentication
    ) {
        return ResponseEntity.ok(activityProgressService.getDayProgress(planId, dayIndex, authentication.getName()));
    }
}
