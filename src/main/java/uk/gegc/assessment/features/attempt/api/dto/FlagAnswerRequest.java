package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FlagAnswerRequest")
public record FlagAnswerRequest(
        @Schema(description = "True to mark the question for review", example = "true") boolean flagged
) {
}
