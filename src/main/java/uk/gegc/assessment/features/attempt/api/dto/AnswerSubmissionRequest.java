package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.UUID;

@Schema(
        name = "AnswerSubmissionRequest",
        description = "Payload for saving an answer to a specific question"
)
public record AnswerSubmissionRequest(
        @Schema(
                description = "UUID of the question to answer",
                requiredMode = Schema.RequiredMode.REQUIRED,
                example = "3fa85f64-5717-4562-b3fc-2c963f66afa6"
        )
        @NotNull(message = "Question ID is required")
        UUID questionId,

        @Schema(
                description = "The answer payload; shape depends on the question type. An empty object clears the answer.",
                requiredMode = Schema.RequiredMode.REQUIRED,
                example = "{\"answer\":true}"
        )
        @NotNull(message = "Response payload must not be null")
        JsonNode response,

        @Schema(description = "Seconds spent on this question since the last save", example = "42")
        @PositiveOrZero(message = "Time spent must not be negative")
        Long timeSpentSeconds,

        @Schema(description = "Index of the question the student is viewing", example = "3")
        @PositiveOrZero(message = "Question index must not be negative")
        Integer currentQuestionIndex
) {
}
