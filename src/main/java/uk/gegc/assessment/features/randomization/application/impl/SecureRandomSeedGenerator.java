package uk.gegc.assessment.features.randomization.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.randomization.application.SeedGenerator;

import java.security.SecureRandom;
import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class SecureRandomSeedGenerator implements SeedGenerator {

    private final SecureRandom secureRandom;
    private final Clock clock;

    @Override
    public long nextSeed() {
        try {
            return secureRandom.nextLong();
        } catch (RuntimeException e) {
            // Entropy source failures surface as unchecked provider exceptions
            log.warn("Secure seed generation failed, falling back to clock-derived seed: {}", e.getMessage());
            return clock.millis();
        }
    }
}
