package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;

import java.util.List;

@Schema(name = "SubmitAttemptRequest", description = "Final answers saved before the attempt is completed")
public record SubmitAttemptRequest(
        @Schema(description = "Answers to save; may be empty when everything was saved already")
        List<@Valid AnswerSubmissionRequest> answers
) {
    public SubmitAttemptRequest {
        if (answers == null) {
            answers = List.of();
        }
    }
}
