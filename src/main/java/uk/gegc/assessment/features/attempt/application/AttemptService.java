package uk.gegc.assessment.features.attempt.application;

import uk.gegc.assessment.features.attempt.api.dto.AnswerDto;
import uk.gegc.assessment.features.attempt.api.dto.AnswerSubmissionRequest;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.StartAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.SubmitAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.TimeRemainingDto;
import uk.gegc.assessment.features.attempt.domain.model.ClientInfo;
import uk.gegc.assessment.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

/**
 * Attempt lifecycle. Every mutating call first compares the clock with the attempt's
 * deadline and moves an overdue attempt to TIMEOUT before doing anything else.
 */
public interface AttemptService {

    /**
     * Starts an attempt, or returns the student's unexpired attempt in progress unchanged.
     */
    AttemptDto startAttempt(UUID assessmentId, User student, StartAttemptRequest request, ClientInfo clientInfo);

    AttemptDetailDto resumeAttempt(UUID attemptId, User student);

    AnswerDto submitAnswer(UUID attemptId, AnswerSubmissionRequest request, User student);

    /**
     * Saves the given answers, completes the attempt and queues grading. The returned
     * attempt may not be graded yet.
     */
    AttemptDto submitAttempt(UUID attemptId, SubmitAttemptRequest request, User student);

    AttemptDto abandonAttempt(UUID attemptId, User student);

    /**
     * Moves an attempt in progress to TIMEOUT and queues grading.
     *
     * @return false when the attempt was already terminal
     */
    boolean handleTimeout(UUID attemptId);

    AttemptDto extendTime(UUID attemptId, int minutes, User grader);

    AttemptDetailDto getAttemptDetail(UUID attemptId, User requester);

    TimeRemainingDto getTimeRemaining(UUID attemptId, User student);

    List<AttemptDto> listAttempts(UUID assessmentId, User requester);

    AnswerDto flagAnswer(UUID attemptId, UUID questionId, boolean flagged, User student);
}
