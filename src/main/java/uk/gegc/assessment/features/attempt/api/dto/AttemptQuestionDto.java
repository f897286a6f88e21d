package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.question.domain.model.QuestionType;

import java.util.UUID;

@Schema(name = "AttemptQuestionDto", description = "A question as shown within an attempt")
public record AttemptQuestionDto(
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Question type") QuestionType type,
        @Schema(description = "Question prompt") String questionText,
        @Schema(description = "Type-specific content; correctness data removed unless in review mode") JsonNode content,
        @Schema(description = "Points this question is worth in the assessment") int points,
        @Schema(description = "Position in the authored order") int order,
        @Schema(description = "Explanation; only present in review mode") String explanation,
        @Schema(description = "The student's answer") AnswerDto answer
) {
}
