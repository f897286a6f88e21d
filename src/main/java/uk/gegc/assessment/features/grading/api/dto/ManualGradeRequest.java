package uk.gegc.assessment.features.grading.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

@Schema(name = "ManualGradeRequest", description = "Score and feedback assigned by a grader")
public record ManualGradeRequest(
        @Schema(description = "Points awarded; between 0 and the question's points", example = "7.5",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Score is required")
        @PositiveOrZero(message = "Score must not be negative")
        Double score,

        @Schema(description = "Feedback for the student", example = "Good structure, but the conclusion is missing.")
        @Size(max = 2000, message = "Feedback must not exceed 2000 characters")
        String feedback
) {
}
