package uk.gegc.assessment.features.attempt.domain.model;

public enum AttemptEndReason {
    SUBMITTED,
    TIME_OUT,
    ABANDONED
}
