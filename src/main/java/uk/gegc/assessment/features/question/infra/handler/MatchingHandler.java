package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;
import java.util.Set;

/**
 * Content: {@code {"leftItems":[{id,text}], "rightItems":[{id,text}], "correctPairs":[{"leftId","rightId"}]}}.
 * Answer: {@code {"matches":{"leftId":"rightId"}}}.
 */
@Component
public class MatchingHandler extends QuestionHandler {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MATCHING;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        Set<String> left = uniqueIds(requireArray(root, "leftItems", 2), "left item");
        Set<String> right = uniqueIds(requireArray(root, "rightItems", 2), "right item");
        ArrayNode pairs = requireArray(root, "correctPairs", 1);
        for (JsonNode pair : pairs) {
            String leftId = pair.path("leftId").asText();
            String rightId = pair.path("rightId").asText();
            if (!left.contains(leftId) || !right.contains(rightId)) {
                throw new ValidationException("Pair " + leftId + " -> " + rightId + " references an unknown item");
            }
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        JsonNode matches = root.get("matches");
        if (matches != null && !matches.isObject()) {
            throw new ValidationException("'matches' must map left item ids to right item ids");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        JsonNode given = answer.path("matches");
        ArrayNode pairs = (ArrayNode) content.get("correctPairs");
        int correct = 0;
        for (JsonNode pair : pairs) {
            JsonNode chosen = given.get(pair.get("leftId").asText());
            if (chosen != null && chosen.asText().equals(pair.get("rightId").asText())) {
                correct++;
            }
        }
        return correct == pairs.size()
                ? ScoreResult.CORRECT
                : new ScoreResult((double) correct / pairs.size(), false);
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "All items matched correctly!";
        }
        return "Some matches are incorrect. Please review your pairings.";
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("correctPairs");
    }

    @Override
    protected List<String> shuffleableFields() {
        return List.of("rightItems");
    }
}
