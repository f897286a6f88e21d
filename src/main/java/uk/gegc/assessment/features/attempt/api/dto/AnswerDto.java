package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AnswerDto", description = "A student's answer to one question")
public record AnswerDto(
        @Schema(description = "Answer UUID") UUID answerId,
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Submitted payload; null when unanswered") JsonNode response,
        @Schema(description = "Points earned") Double score,
        @Schema(description = "Points available") Double maxScore,
        @Schema(description = "True or false once graded, null while ungraded") Boolean isCorrect,
        @Schema(description = "Whether a score has been assigned") boolean graded,
        @Schema(description = "Grader feedback") String feedback,
        @Schema(description = "Flagged for review by the student") boolean flagged,
        @Schema(description = "Accumulated seconds spent on this question") long timeSpentSeconds,
        @Schema(description = "Last change timestamp (UTC)") Instant lastModifiedAt
) {
}
