package uk.gegc.assessment.features.grading.application;

import uk.gegc.assessment.features.grading.api.dto.AttemptGradingResult;
import uk.gegc.assessment.features.grading.api.dto.GradingResult;
import uk.gegc.assessment.features.grading.api.dto.ManualGradeRequest;
import uk.gegc.assessment.features.user.domain.model.User;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface GradingService {

    /**
     * Scores every answer of a completed or timed-out attempt and stores the aggregate, all in
     * one transaction. A failure to score a single answer leaves that answer ungraded; a
     * persistence failure rolls the whole attempt back.
     */
    AttemptGradingResult autoGradeAttempt(UUID attemptId);

    /**
     * Same as {@link #autoGradeAttempt(UUID)} after checking that the caller may grade the
     * attempt's assessment.
     */
    AttemptGradingResult gradeAttempt(UUID attemptId, User grader);

    GradingResult manualGradeAnswer(UUID answerId, ManualGradeRequest request, User grader);

    /**
     * Recomputes the attempt aggregate once no answer is left ungraded.
     *
     * @return true if the attempt was regraded
     */
    boolean finalizeIfFullyGraded(UUID attemptId);

    Map<UUID, AttemptGradingResult> autoGradeAssessment(UUID assessmentId, User grader);

    List<GradingResult> reGradeQuestion(UUID questionId, User grader);

    Map<UUID, AttemptGradingResult> reGradeAssessment(UUID assessmentId, User grader);
}
