package uk.gegc.assessment.features.grading.domain.model;

/**
 * Letter bands over the attempt percentage, highest first.
 */
public enum LetterGrade {
    A_PLUS("A+", 97),
    A("A", 93),
    A_MINUS("A-", 90),
    B_PLUS("B+", 87),
    B("B", 83),
    B_MINUS("B-", 80),
    C_PLUS("C+", 77),
    C("C", 73),
    C_MINUS("C-", 70),
    D("D", 60),
    F("F", 0);

    private final String label;
    private final double minimumPercentage;

    LetterGrade(String label, double minimumPercentage) {
        this.label = label;
        this.minimumPercentage = minimumPercentage;
    }

    public String label() {
        return label;
    }

    public static LetterGrade fromPercentage(double percentage) {
        for (LetterGrade grade : values()) {
            if (percentage >= grade.minimumPercentage) {
                return grade;
            }
        }
        return F;
    }
}
