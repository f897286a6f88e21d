package uk.gegc.assessment.features.attempt.domain.event;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published for every terminal transition, abandon included. Used to release per-attempt
 * resources such as shuffle seeds.
 */
public class AttemptClosedEvent extends ApplicationEvent {

    private final UUID attemptId;

    public AttemptClosedEvent(Object source, UUID attemptId) {
        super(source);
        this.attemptId = attemptId;
    }

    public UUID getAttemptId() {
        return attemptId;
    }
}
