package uk.gegc.assessment.features.question.domain.model;

public enum QuestionType {
    MULTIPLE_CHOICE(true),
    TRUE_FALSE(true),
    ESSAY(false),
    FILL_IN_BLANK(true),
    MATCHING(true),
    ORDERING(true),
    SHORT_ANSWER(true);

    private final boolean autoGradeable;

    QuestionType(boolean autoGradeable) {
        this.autoGradeable = autoGradeable;
    }

    public boolean isAutoGradeable() {
        return autoGradeable;
    }
}
