package uk.gegc.assessment.features.question.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.infra.factory.QuestionHandlerFactory;

/**
 * Removes correct-answer data from question content before it is shown to a student
 * mid-attempt. Returns a copy; the input is left untouched.
 */
@Component
@RequiredArgsConstructor
public class AnswerSanitizer {

    private final QuestionHandlerFactory handlerFactory;

    public ObjectNode sanitize(QuestionType type, JsonNode content) {
        return handlerFactory.getHandler(type).sanitize(content);
    }
}
