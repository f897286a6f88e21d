package uk.gegc.assessment.features.assessment.domain.model;

public enum AssessmentStatus {
    DRAFT,
    ACTIVE,
    EXPIRED,
    ARCHIVED
}
