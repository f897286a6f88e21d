package uk.gegc.assessment.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Single source of time and entropy for the application. Deadlines, timeouts and seed
 * generation all read from these beans so tests can pin them.
 */
@Configuration
public class ClockConfig {

    @Value("${app.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
