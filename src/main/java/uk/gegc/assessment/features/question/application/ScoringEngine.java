package uk.gegc.assessment.features.question.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.features.question.infra.factory.QuestionHandlerFactory;

/**
 * Entry point to per-type scoring. Pure: no persistence, no clock, no randomness.
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

    private final QuestionHandlerFactory handlerFactory;

    /**
     * @throws uk.gegc.assessment.shared.exception.GradingNotAllowedException for manual-only types
     * @throws uk.gegc.assessment.shared.exception.ValidationException        for malformed content or answers
     */
    public ScoreResult score(QuestionType type, JsonNode content, JsonNode answer) {
        return handlerFactory.getHandler(type).score(content, answer);
    }

    public String feedback(QuestionType type, JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        return handlerFactory.getHandler(type).feedback(content, answer, fullyCorrect, revealCorrect);
    }

    public void validateAnswer(QuestionType type, JsonNode answer) {
        handlerFactory.getHandler(type).validateAnswer(answer);
    }
}
