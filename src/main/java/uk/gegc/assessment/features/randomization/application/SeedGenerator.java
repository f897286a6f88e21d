package uk.gegc.assessment.features.randomization.application;

public interface SeedGenerator {

    long nextSeed();
}
