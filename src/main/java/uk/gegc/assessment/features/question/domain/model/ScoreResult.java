package uk.gegc.assessment.features.question.domain.model;

/**
 * Outcome of scoring one answer, before it is weighted by the question's points.
 *
 * @param ratio        normalised credit in [0, 1]
 * @param fullyCorrect true only when the answer earns full credit
 */
public record ScoreResult(double ratio, boolean fullyCorrect) {

    public static final ScoreResult CORRECT = new ScoreResult(1.0, true);
    public static final ScoreResult INCORRECT = new ScoreResult(0.0, false);

    public ScoreResult {
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("Score ratio must be within [0, 1], got " + ratio);
        }
    }

    public static ScoreResult partial(double ratio) {
        return ratio >= 1.0 ? CORRECT : new ScoreResult(Math.max(0.0, ratio), false);
    }
}
