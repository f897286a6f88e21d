package uk.gegc.assessment.features.randomization.application;

import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.randomization.domain.model.ShufflePlan;
import uk.gegc.assessment.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

public interface RandomizationService {

    /**
     * Generates and caches the seeds an attempt needs, according to its assessment's
     * randomization flags. Does nothing when neither flag is set.
     */
    void initializeSeeds(Attempt attempt);

    /**
     * Decides what the requester sees shuffled. Only the owning student of an attempt in
     * progress gets a shuffled view, and only along the dimensions the assessment enables
     * and the cache still holds a seed for.
     */
    ShufflePlan planFor(Attempt attempt, User requester);

    /**
     * Deterministic permutation: the same seed and input always produce the same order.
     * Returns a new list.
     */
    <T> List<T> shuffle(List<T> items, long seed);

    void clearSeeds(UUID attemptId);
}
