package uk.gegc.assessment.features.randomization.application;

import uk.gegc.assessment.features.randomization.domain.model.SeedType;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Best-effort storage for shuffle seeds. Implementations never throw; an unavailable store
 * reads as empty and ignores writes.
 */
public interface SeedStore {

    Optional<Long> get(UUID attemptId, SeedType type);

    /**
     * Stores the seed unless one is already present.
     *
     * @return the seed now held by the store, which is the existing one when another writer won,
     * or empty when the store is unavailable
     */
    Optional<Long> putIfAbsent(UUID attemptId, SeedType type, long seed, Duration ttl);

    void delete(UUID attemptId);
}
