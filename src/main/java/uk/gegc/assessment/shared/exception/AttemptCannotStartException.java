package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class AttemptCannotStartException extends RuntimeException {
    public AttemptCannotStartException(String message) {
        super(message);
    }
}
