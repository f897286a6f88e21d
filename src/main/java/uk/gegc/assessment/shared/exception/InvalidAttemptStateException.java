package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;

import java.util.UUID;

/**
 * Thrown when an operation is not valid for the attempt's current status.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidAttemptStateException extends RuntimeException {

    private final UUID attemptId;
    private final AttemptStatus status;

    public InvalidAttemptStateException(UUID attemptId, AttemptStatus status, String operation) {
        super("Cannot " + operation + " attempt " + attemptId + " in status " + status);
        this.attemptId = attemptId;
        this.status = status;
    }

    public UUID getAttemptId() {
        return attemptId;
    }

    public AttemptStatus getStatus() {
        return status;
    }
}
