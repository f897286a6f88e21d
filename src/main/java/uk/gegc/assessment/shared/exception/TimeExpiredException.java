package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Thrown when a mutating call arrives after the attempt's deadline. By the time this
 * is raised the attempt has already been moved to TIMEOUT.
 */
@ResponseStatus(HttpStatus.GONE)
public class TimeExpiredException extends RuntimeException {

    private final UUID attemptId;
    private final Instant endsAt;

    public TimeExpiredException(UUID attemptId, Instant endsAt) {
        super("Time for attempt " + attemptId + " expired at " + endsAt);
        this.attemptId = attemptId;
        this.endsAt = endsAt;
    }

    public UUID getAttemptId() {
        return attemptId;
    }

    public Instant getEndsAt() {
        return endsAt;
    }
}
