package uk.gegc.assessment.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;
import uk.gegc.assessment.features.question.domain.model.QuestionType;

/**
 * Raised by the scoring engine for question types that can only be graded by a person.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class GradingNotAllowedException extends RuntimeException {

    private final QuestionType type;

    public GradingNotAllowedException(QuestionType type) {
        super("Automatic grading is not allowed for question type " + type);
        this.type = type;
    }

    public QuestionType getType() {
        return type;
    }
}
