package uk.gegc.readingplan.features.plan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.readingplan.features.plan.domain.model.PlanVariant;

@Schema(name = "CreatePlanRequest", description = "Request to generate a new reading plan for a student")
public record CreatePlanRequest(
        @Schema(description = "Student the plan is for", example = "42", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "studentId is required")
        Long studentId,

        @Schema(description = "Display name of the plan", example = "Summer Adventures")
        @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must not exceed 100 characters")
        String name,

        @Schema(description = "Story theme", example = "space")
        @NotBlank(message = "theme is required")
        @Size(max = 50, message = "theme must not exceed 50 characters")
        String theme,

        @Schema(description = "Plan length; defaults to 3-day", example = "3-day", allowableValues = {"3-day", "5-day"})
        PlanVariant variant
) {
}
