package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "AttemptDetailDto", description = "Attempt with its questions and answers")
public record AttemptDetailDto(
        @Schema(description = "Attempt state") AttemptDto attempt,
        @Schema(description = "Questions in display order") List<AttemptQuestionDto> questions,
        @Schema(description = "True when correctness data is included") boolean reviewMode
) {
}
