package uk.gegc.assessment.features.randomization.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.randomization.application.RandomizationService;
import uk.gegc.assessment.features.randomization.application.SeedGenerator;
import uk.gegc.assessment.features.randomization.application.SeedStore;
import uk.gegc.assessment.features.randomization.domain.model.SeedType;
import uk.gegc.assessment.features.randomization.domain.model.ShufflePlan;
import uk.gegc.assessment.features.user.domain.model.User;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

@Slf4j
@Service
public class RandomizationServiceImpl implements RandomizationService {

    private final SeedStore seedStore;
    private final SeedGenerator seedGenerator;
    private final long graceMinutes;

    public RandomizationServiceImpl(SeedStore seedStore,
                                    SeedGenerator seedGenerator,
                                    @Value("${randomization.seed-ttl-grace-minutes:30}") long graceMinutes) {
        this.seedStore = seedStore;
        this.seedGenerator = seedGenerator;
        this.graceMinutes = graceMinutes;
    }

    @Override
    public void initializeSeeds(Attempt attempt) {
        Assessment assessment = attempt.getAssessment();
        if (!assessment.isRandomizeQuestions() && !assessment.isRandomizeOptions()) {
            return;
        }
        // Outlive the attempt, extensions included up to the grace period
        Duration ttl = Duration.ofMinutes(assessment.getDurationMinutes() + graceMinutes);
        if (assessment.isRandomizeQuestions()) {
            seedStore.putIfAbsent(attempt.getId(), SeedType.QUESTION, seedGenerator.nextSeed(), ttl);
        }
        if (assessment.isRandomizeOptions()) {
            seedStore.putIfAbsent(attempt.getId(), SeedType.OPTION, seedGenerator.nextSeed(), ttl);
        }
        log.debug("Initialized shuffle seeds for attempt {} with ttl {}", attempt.getId(), ttl);
    }

    @Override
    public ShufflePlan planFor(Attempt attempt, User requester) {
        if (!attempt.isInProgress()) {
            return ShufflePlan.NONE;
        }
        if (requester == null || attempt.getUser() == null || !attempt.getUser().getId().equals(requester.getId())) {
            return ShufflePlan.NONE;
        }
        Assessment assessment = attempt.getAssessment();
        Long questionSeed = assessment.isRandomizeQuestions()
                ? seedStore.get(attempt.getId(), SeedType.QUESTION).orElse(null)
                : null;
        Long optionSeed = assessment.isRandomizeOptions()
                ? seedStore.get(attempt.getId(), SeedType.OPTION).orElse(null)
                : null;
        return new ShufflePlan(questionSeed, optionSeed);
    }

    @Override
    public <T> List<T> shuffle(List<T> items, long seed) {
        List<T> copy = new ArrayList<>(items);
        Collections.shuffle(copy, new Random(seed));
        return copy;
    }

    @Override
    public void clearSeeds(UUID attemptId) {
        seedStore.delete(attemptId);
        log.debug("Cleared shuffle seeds for attempt {}", attemptId);
    }
}
