package uk.gegc.assessment.features.attempt.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.assessment.features.attempt.domain.model.AttemptEndReason;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an attempt leaves IN_PROGRESS through submission or timeout. Listeners
 * run after the transition commits and hand the attempt to grading.
 */
public class AttemptFinalizedEvent extends ApplicationEvent {

    private final UUID attemptId;
    private final UUID assessmentId;
    private final UUID userId;
    private final AttemptStatus status;
    private final AttemptEndReason endReason;
    private final Instant finalizedAt;

    public AttemptFinalizedEvent(Object source,
                                 UUID attemptId,
                                 UUID assessmentId,
                                 UUID userId,
                                 AttemptStatus status,
                                 AttemptEndReason endReason,
                                 Instant finalizedAt) {
        super(source);
        this.attemptId = attemptId;
        this.assessmentId = assessmentId;
        this.userId = userId;
        this.status = status;
        this.endReason = endReason;
        this.finalizedAt = finalizedAt;
    }

    public UUID getAttemptId() {
        return attemptId;
    }

    public UUID getAssessmentId() {
        return assessmentId;
    }

    public UUID getUserId() {
        return userId;
    }

    public AttemptStatus getStatus() {
        return status;
    }

    public AttemptEndReason getEndReason() {
        return endReason;
    }

    public Instant getFinalizedAt() {
        return finalizedAt;
    }
}
