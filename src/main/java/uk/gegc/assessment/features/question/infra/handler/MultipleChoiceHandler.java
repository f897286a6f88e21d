package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Content: {@code {"options":[{"id","text"}], "correctAnswers":[ids], "multipleCorrect":bool}}.
 * Answer: {@code {"selectedOptionIds":[ids]}}.
 */
@Component
public class MultipleChoiceHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        Set<String> ids = uniqueIds(requireArray(root, "options", 2), "option");

        ArrayNode correct = requireArray(root, "correctAnswers", 1);
        for (JsonNode id : correct) {
            if (!ids.contains(id.asText())) {
                throw new ValidationException("Correct answer '" + id.asText() + "' does not match any option");
            }
        }
        if (correct.size() > 1 && !root.path("multipleCorrect").asBoolean(true)) {
            throw new ValidationException("MULTIPLE_CHOICE has several correct answers but multipleCorrect is false");
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        JsonNode selected = root.get("selectedOptionIds");
        if (selected != null && !selected.isArray()) {
            throw new ValidationException("'selectedOptionIds' must be an array");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        Set<String> correct = new HashSet<>(textValues(content.get("correctAnswers")));
        Set<String> selected = new HashSet<>(textValues(answer.get("selectedOptionIds")));

        if (correct.equals(selected)) {
            return ScoreResult.CORRECT;
        }
        if (correct.size() <= 1) {
            return ScoreResult.INCORRECT;
        }

        // Wrong picks and missed correct options each cancel one correct pick
        int correctSelected = 0;
        int penalties = 0;
        for (String id : selected) {
            if (correct.contains(id)) {
                correctSelected++;
            } else {
                penalties++;
            }
        }
        for (String id : correct) {
            if (!selected.contains(id)) {
                penalties++;
            }
        }
        double ratio = (double) (correctSelected - penalties) / correct.size();
        return new ScoreResult(Math.max(0.0, ratio), false);
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "Correct! Well done.";
        }
        if (!revealCorrect || content == null) {
            return INCORRECT_FEEDBACK;
        }
        Set<String> correct = new HashSet<>(textValues(content.get("correctAnswers")));
        List<String> texts = new ArrayList<>();
        for (JsonNode option : content.path("options")) {
            if (correct.contains(option.path("id").asText())) {
                texts.add(option.path("text").asText());
            }
        }
        if (texts.isEmpty()) {
            return INCORRECT_FEEDBACK;
        }
        return texts.size() == 1
                ? "Incorrect. The correct answer is: " + texts.get(0)
                : "Incorrect. The correct answers are: " + String.join(", ", texts);
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("correctAnswers");
    }

    @Override
    protected void stripNested(ObjectNode copy) {
        for (JsonNode option : copy.path("options")) {
            if (option.isObject()) {
                ((ObjectNode) option).remove("correct");
            }
        }
    }

    @Override
    protected List<String> shuffleableFields() {
        return List.of("options");
    }
}
