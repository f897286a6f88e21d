package uk.gegc.assessment.features.attempt.domain.model;

/**
 * IN_PROGRESS is the only non-terminal state. Every transition leaves it and none returns.
 */
public enum AttemptStatus {
    IN_PROGRESS,
    COMPLETED,
    ABANDONED,
    TIMEOUT;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    public boolean canTransitionTo(AttemptStatus next) {
        return this == IN_PROGRESS && next != null && next.isTerminal();
    }

    /**
     * Statuses whose answers count for grading and review.
     */
    public boolean isGradeable() {
        return this == COMPLETED || this == TIMEOUT;
    }
}
