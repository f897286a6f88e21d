package uk.gegc.assessment.features.grading.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a grader scores an answer by hand. Once committed, the owning attempt is
 * checked for remaining ungraded answers.
 */
public class ManualGradeRecordedEvent extends ApplicationEvent {

    private final UUID answerId;
    private final UUID attemptId;
    private final UUID graderId;

    public ManualGradeRecordedEvent(Object source, UUID answerId, UUID attemptId, UUID graderId) {
        super(source);
        this.answerId = answerId;
        this.attemptId = attemptId;
        this.graderId = graderId;
    }

    public UUID getAnswerId() {
        return answerId;
    }

    public UUID getAttemptId() {
        return attemptId;
    }

    public UUID getGraderId() {
        return graderId;
    }
}
