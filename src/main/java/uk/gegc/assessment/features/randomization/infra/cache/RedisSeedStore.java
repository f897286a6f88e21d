package uk.gegc.assessment.features.randomization.infra.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.randomization.application.SeedStore;
import uk.gegc.assessment.features.randomization.domain.model.SeedType;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSeedStore implements SeedStore {

    private static final String KEY_PREFIX = "attempt:seed:";

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<Long> get(UUID attemptId, SeedType type) {
        String key = key(attemptId, type);
        try {
            return parse(key, redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            log.warn("Seed cache read failed for {}, shuffling disabled for this request: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Long> putIfAbsent(UUID attemptId, SeedType type, long seed, Duration ttl) {
        String key = key(attemptId, type);
        try {
            Boolean stored = redisTemplate.opsForValue()
                    .setIfAbsent(key, String.valueOf(seed), ttl.toSeconds(), TimeUnit.SECONDS);
            if (Boolean.TRUE.equals(stored)) {
                return Optional.of(seed);
            }
            // Someone else stored first; theirs stands
            return parse(key, redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            log.warn("Seed cache write failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(UUID attemptId) {
        List<String> keys = Arrays.stream(SeedType.values())
                .map(type -> key(attemptId, type))
                .toList();
        try {
            redisTemplate.delete(keys);
        } catch (RuntimeException e) {
            log.warn("Seed cache delete failed for attempt {}, entries will expire by TTL: {}", attemptId, e.getMessage());
        }
    }

    static String key(UUID attemptId, SeedType type) {
        return KEY_PREFIX + attemptId + ":" + type.key();
    }

    private Optional<Long> parse(String key, String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            log.warn("Ignoring corrupt seed value under {}", key);
            return Optional.empty();
        }
    }
}
