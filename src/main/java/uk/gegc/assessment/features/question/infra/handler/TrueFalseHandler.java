package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;

@Component
public class TrueFalseHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.TRUE_FALSE;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        JsonNode answer = root.get("correctAnswer");
        if (answer == null || !answer.isBoolean()) {
            throw new ValidationException("TRUE_FALSE requires boolean 'correctAnswer'");
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        if (!root.path("answer").isBoolean()) {
            throw new ValidationException("TRUE_FALSE answer requires boolean 'answer'");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        return content.get("correctAnswer").asBoolean() == answer.get("answer").asBoolean()
                ? ScoreResult.CORRECT
                : ScoreResult.INCORRECT;
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "Correct!";
        }
        if (!revealCorrect || content == null || !content.path("correctAnswer").isBoolean()) {
            return INCORRECT_FEEDBACK;
        }
        boolean correct = content.get("correctAnswer").asBoolean();
        String label = correct
                ? content.path("trueLabel").asText("True")
                : content.path("falseLabel").asText("False");
        return "Incorrect. The correct answer is: " + label;
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("correctAnswer");
    }
}
