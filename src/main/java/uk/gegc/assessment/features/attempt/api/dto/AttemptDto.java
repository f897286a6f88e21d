package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.attempt.domain.model.AttemptEndReason;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AttemptDto", description = "Attempt state and, once graded, its aggregate result")
public record AttemptDto(
        @Schema(description = "Attempt UUID") UUID attemptId,
        @Schema(description = "Assessment UUID") UUID assessmentId,
        @Schema(description = "Student UUID") UUID userId,
        @Schema(description = "1-based attempt number for this student and assessment") int attemptNumber,
        @Schema(description = "Current status") AttemptStatus status,
        @Schema(description = "Start timestamp (UTC)") Instant startedAt,
        @Schema(description = "Deadline (UTC)") Instant endsAt,
        @Schema(description = "Completion timestamp; null while in progress") Instant completedAt,
        @Schema(description = "Seconds between start and completion, capped at the deadline") long timeSpentSeconds,
        @Schema(description = "Seconds left before the deadline") long timeRemainingSeconds,
        @Schema(description = "Points earned; null until grading has run") Double score,
        @Schema(description = "Points available") Double maxScore,
        @Schema(description = "Score as a percentage of maxScore") Double percentage,
        @Schema(description = "Whether percentage reaches the passing score") Boolean passed,
        @Schema(description = "False while any answer still awaits grading") boolean graded,
        @Schema(description = "Letter grade derived from percentage; null until grading has run") String letterGrade,
        @Schema(description = "Index of the question the student is on") int currentQuestionIndex,
        @Schema(description = "Number of answered questions") int questionsAnswered,
        @Schema(description = "Number of questions in the attempt") int totalQuestions,
        @Schema(description = "Why the attempt ended") AttemptEndReason endReason
) {
}
