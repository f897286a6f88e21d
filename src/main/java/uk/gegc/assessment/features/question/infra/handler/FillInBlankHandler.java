package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Content: {@code {"template":"...", "blanks":{"b1":{"acceptedAnswers":[..],"points":2}}, "caseSensitive":false}}.
 * Answer: {@code {"blanks":{"b1":"text"}}}.
 */
@Component
public class FillInBlankHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.FILL_IN_BLANK;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        if (root.path("template").asText().isBlank()) {
            throw new ValidationException("FILL_IN_BLANK requires non-empty 'template' field");
        }
        JsonNode blanks = root.get("blanks");
        if (blanks == null || !blanks.isObject() || blanks.isEmpty()) {
            throw new ValidationException("FILL_IN_BLANK must have at least one blank defined");
        }
        Iterator<Map.Entry<String, JsonNode>> it = blanks.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> blank = it.next();
            JsonNode accepted = blank.getValue().get("acceptedAnswers");
            if (accepted == null || !accepted.isArray() || accepted.isEmpty()) {
                throw new ValidationException("Blank '" + blank.getKey() + "' must list at least one accepted answer");
            }
            if (blank.getValue().path("points").asInt(1) < 0) {
                throw new ValidationException("Blank '" + blank.getKey() + "' must not have negative points");
            }
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        JsonNode blanks = root.get("blanks");
        if (blanks != null && !blanks.isObject()) {
            throw new ValidationException("'blanks' must be an object keyed by blank id");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        boolean caseSensitive = content.path("caseSensitive").asBoolean(false);
        JsonNode given = answer.path("blanks");

        int totalPoints = 0;
        int earnedPoints = 0;
        boolean allCorrect = true;

        Iterator<Map.Entry<String, JsonNode>> it = content.get("blanks").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> blank = it.next();
            int points = blank.getValue().path("points").asInt(1);
            totalPoints += points;

            JsonNode response = given.get(blank.getKey());
            boolean correct = response != null && response.isTextual()
                    && textValues(blank.getValue().get("acceptedAnswers")).stream()
                    .anyMatch(accepted -> matches(response.asText(), accepted, caseSensitive));
            if (correct) {
                earnedPoints += points;
            } else {
                allCorrect = false;
            }
        }

        if (totalPoints == 0) {
            return ScoreResult.INCORRECT;
        }
        double ratio = (double) earnedPoints / totalPoints;
        return allCorrect ? ScoreResult.CORRECT : new ScoreResult(ratio, false);
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "All blanks filled correctly!";
        }
        return "Some answers are incorrect. Please review your responses.";
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of();
    }

    @Override
    protected void stripNested(ObjectNode copy) {
        JsonNode blanks = copy.get("blanks");
        if (blanks == null || !blanks.isObject()) {
            return;
        }
        blanks.elements().forEachRemaining(blank -> {
            if (blank.isObject()) {
                ((ObjectNode) blank).remove("acceptedAnswers");
            }
        });
    }
}
