package uk.gegc.assessment.features.user.domain.model;

public enum RoleName {
    STUDENT,    // Takes assessments
    TEACHER,    // Creates assessments, grades attempts on them
    ADMIN;      // Grades and manages any assessment

    public boolean canGrade() {
        return this == TEACHER || this == ADMIN;
    }
}
