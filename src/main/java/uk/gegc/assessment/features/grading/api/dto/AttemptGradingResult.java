package uk.gegc.assessment.features.grading.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "AttemptGradingResult", description = "Aggregate outcome of grading one attempt")
public record AttemptGradingResult(
        @Schema(description = "Attempt UUID") UUID attemptId,
        @Schema(description = "Points earned across the attempt", example = "80.0") double totalScore,
        @Schema(description = "Points available across the attempt", example = "100.0") double maxScore,
        @Schema(description = "totalScore as a percentage of maxScore", example = "80.0") double percentage,
        @Schema(description = "Whether percentage reaches the passing score") boolean passed,
        @Schema(description = "Letter grade", example = "B-") String letterGrade,
        @Schema(description = "False while some answers still need a grader") boolean fullyGraded,
        @Schema(description = "Per-answer results") List<GradingResult> questions,
        @Schema(description = "Grading timestamp (UTC)") Instant gradedAt
) {
}
