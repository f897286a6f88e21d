package uk.gegc.assessment.features.randomization.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecureRandomSeedGeneratorTest {

    @Mock
    private SecureRandom secureRandom;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("returns the secure random value")
    void usesSecureRandom() {
        when(secureRandom.nextLong()).thenReturn(987654321L);

        assertThat(new SecureRandomSeedGenerator(secureRandom, clock).nextSeed()).isEqualTo(987654321L);
    }

    @Test
    @DisplayName("entropy failure: falls back to the clock")
    void fallsBackToClock() {
        when(secureRandom.nextLong()).thenThrow(new IllegalStateException("no entropy"));

        assertThat(new SecureRandomSeedGenerator(secureRandom, clock).nextSeed()).isEqualTo(clock.millis());
    }
}
