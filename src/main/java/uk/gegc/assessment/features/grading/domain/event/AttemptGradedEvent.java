package uk.gegc.assessment.features.grading.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

public class AttemptGradedEvent extends ApplicationEvent {

    private final UUID attemptId;
    private final UUID assessmentId;
    private final UUID userId;
    private final double percentage;
    private final boolean passed;
    private final boolean fullyGraded;

    public AttemptGradedEvent(Object source,
                              UUID attemptId,
                              UUID assessmentId,
                              UUID userId,
                              double percentage,
                              boolean passed,
                              boolean fullyGraded) {
        super(source);
        this.attemptId = attemptId;
        this.assessmentId = assessmentId;
        this.userId = userId;
        this.percentage = percentage;
        this.passed = passed;
        this.fullyGraded = fullyGraded;
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

    public double getPercentage() {
        return percentage;
    }

    public boolean isPassed() {
        return passed;
    }

    /**
     * False while answers of manual-only types still wait for a grader.
     */
    public boolean isFullyGraded() {
        return fullyGraded;
    }
}
