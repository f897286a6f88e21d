package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.GradingNotAllowedException;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;

/**
 * Essays are graded by people. Scoring always refuses; the orchestrator leaves the answer
 * ungraded for a teacher to pick up.
 */
@Component
public class EssayHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.ESSAY;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        int minWords = root.path("minWords").asInt(0);
        int maxWords = root.path("maxWords").asInt(0);
        if (minWords < 0 || maxWords < 0) {
            throw new ValidationException("ESSAY word limits must not be negative");
        }
        if (maxWords > 0 && minWords > maxWords) {
            throw new ValidationException("ESSAY minWords must not exceed maxWords");
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        if (!root.path("text").isTextual()) {
            throw new ValidationException("ESSAY answer requires 'text'");
        }
    }

    @Override
    public ScoreResult score(JsonNode content, JsonNode answer) {
        throw new GradingNotAllowedException(supportedType());
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        throw new GradingNotAllowedException(supportedType());
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        return "Essay questions require manual grading.";
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("sampleAnswer", "keyWords");
    }
}
