package uk.gegc.assessment.features.grading.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.question.domain.model.Answer;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "GradingResult", description = "Outcome of grading one answer")
public record GradingResult(
        @Schema(description = "Answer UUID") UUID answerId,
        @Schema(description = "Question UUID") UUID questionId,
        @Schema(description = "Points earned") double score,
        @Schema(description = "Points available") double maxScore,
        @Schema(description = "True or false once graded; null while the answer awaits grading") Boolean isCorrect,
        @Schema(description = "Some but not all points earned") boolean partialCredit,
        @Schema(description = "Whether a score has been assigned") boolean graded,
        @Schema(description = "Feedback shown to the student") String feedback,
        @Schema(description = "Grading timestamp (UTC)") Instant gradedAt,
        @Schema(description = "Grader UUID; null for automatic grading") UUID gradedBy
) {

    public static GradingResult from(Answer answer) {
        double score = answer.getScore() != null ? answer.getScore() : 0.0;
        double maxScore = answer.getMaxScore() != null ? answer.getMaxScore() : 0.0;
        return new GradingResult(
                answer.getId(),
                answer.getQuestion().getId(),
                score,
                maxScore,
                answer.getIsCorrect(),
                answer.isGraded() && score > 0 && score < maxScore,
                answer.isGraded(),
                answer.getFeedback(),
                answer.getGradedAt(),
                answer.getGradedBy()
        );
    }
}
