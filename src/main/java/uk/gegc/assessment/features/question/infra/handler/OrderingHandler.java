package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Content: {@code {"items":[{id,text}], "correctOrder":[ids]}}.
 * Answer: {@code {"orderedItemIds":[ids]}}.
 *
 * <p>Credit is per absolute position. A sequence that is right but shifted by one place
 * earns nothing for the shifted items.
 */
@Component
public class OrderingHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.ORDERING;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        Set<String> ids = uniqueIds(requireArray(root, "items", 2), "item");
        List<String> order = textValues(requireArray(root, "correctOrder", 2));
        if (order.size() != ids.size() || !ids.equals(new HashSet<>(order))) {
            throw new ValidationException("ORDERING correctOrder must list every item exactly once");
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        JsonNode ordered = root.get("orderedItemIds");
        if (ordered != null && !ordered.isArray()) {
            throw new ValidationException("'orderedItemIds' must be an array");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        List<String> expected = textValues(content.get("correctOrder"));
        List<String> given = textValues(answer.get("orderedItemIds"));
        if (given.equals(expected)) {
            return ScoreResult.CORRECT;
        }
        int inPlace = 0;
        for (int i = 0; i < given.size() && i < expected.size(); i++) {
            if (given.get(i).equals(expected.get(i))) {
                inPlace++;
            }
        }
        return new ScoreResult((double) inPlace / content.get("items").size(), false);
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "Perfect sequence!";
        }
        return "The order is not completely correct. Please review the sequence.";
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("correctOrder");
    }

    @Override
    protected List<String> shuffleableFields() {
        return List.of("items");
    }
}
