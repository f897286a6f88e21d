package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.CONFLICT)
public class AttemptAlreadySubmittedException extends RuntimeException {

    private final UUID attemptId;

    public AttemptAlreadySubmittedException(UUID attemptId) {
        super("Attempt " + attemptId + " has already been submitted");
        this.attemptId = attemptId;
    }

    public UUID getAttemptId() {
        return attemptId;
    }
}
