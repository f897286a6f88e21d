package uk.gegc.assessment.features.randomization.domain.model;

import java.util.UUID;

/**
 * What to shuffle for one attempt view. A null seed means that dimension stays in
 * authored order.
 */
public record ShufflePlan(Long questionSeed, Long optionSeed) {

    public static final ShufflePlan NONE = new ShufflePlan(null, null);

    public boolean shuffleQuestions() {
        return questionSeed != null;
    }

    public boolean shuffleOptions() {
        return optionSeed != null;
    }

    /**
     * Seed for one question's options, offset by the question id so that questions with
     * the same number of options do not all get the same permutation.
     */
    public long optionSeedFor(UUID questionId) {
        if (optionSeed == null) {
            throw new IllegalStateException("Option shuffling is not enabled for this plan");
        }
        return optionSeed + questionId.hashCode();
    }
}
