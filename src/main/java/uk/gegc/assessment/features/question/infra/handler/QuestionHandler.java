package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * One implementation per question type. Each handler owns the content schema of its type:
 * how to validate it, score an answer against it, explain the result and strip
 * correctness data from it.
 *
 * <p>Handlers are stateless; all methods are safe to call concurrently.
 */
public abstract class QuestionHandler {

    protected static final String INCORRECT_FEEDBACK = "Incorrect answer.";

    /**
     * Returns the question type that this handler supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    public abstract void validateContent(JsonNode content) throws ValidationException;

    /**
     * Checks the shape of a student's answer payload. Semantic correctness is left to scoring.
     */
    public abstract void validateAnswer(JsonNode answer) throws ValidationException;

    /**
     * Scores an answer against the question content.
     *
     * @return the credit ratio and whether the answer is fully correct
     * @throws ValidationException when the content or the answer payload is malformed
     */
    public ScoreResult score(JsonNode content, JsonNode answer) {
        validateContent(content);
        validateAnswer(answer);
        return doScore(content, answer);
    }

    protected abstract ScoreResult doScore(JsonNode content, JsonNode answer);

    /**
     * Human-readable explanation of a scored answer. Correct-answer text appears only when
     * {@code revealCorrect} is set; the caller decides whether revealing is allowed.
     */
    public abstract String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect);

    /**
     * Returns a deep copy of the content with the correctness fields of this type removed.
     * The input is never mutated.
     */
    public ObjectNode sanitize(JsonNode content) {
        if (content == null || !content.isObject()) {
            throw new ValidationException("Invalid JSON for " + supportedType() + " question");
        }
        ObjectNode copy = ((ObjectNode) content).deepCopy();
        copy.remove(correctnessFields());
        stripNested(copy);
        return copy;
    }

    /**
     * Top-level fields that carry correctness data.
     */
    protected abstract List<String> correctnessFields();

    /**
     * Hook for types whose correctness data sits below the top level.
     */
    protected void stripNested(ObjectNode copy) {
    }

    /**
     * Shuffles the display arrays of this type in place. Types with nothing to shuffle keep
     * the default no-op.
     */
    public void shuffleOptions(ObjectNode content, Random random) {
        for (String field : shuffleableFields()) {
            JsonNode node = content.get(field);
            if (node == null || !node.isArray() || node.size() < 2) {
                continue;
            }
            ArrayNode array = (ArrayNode) node;
            List<JsonNode> items = new ArrayList<>(array.size());
            array.forEach(items::add);
            Collections.shuffle(items, random);
            array.removeAll();
            array.addAll(items);
        }
    }

    protected List<String> shuffleableFields() {
        return List.of();
    }

    // ---------------------------------------------------------------- helpers

    protected ObjectNode requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("Invalid JSON for " + supportedType() + " " + what);
        }
        return (ObjectNode) node;
    }

    protected ArrayNode requireArray(JsonNode parent, String field, int minSize) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw new ValidationException(supportedType() + " requires '" + field + "' array");
        }
        if (node.size() < minSize) {
            throw new ValidationException(supportedType() + " '" + field + "' must have at least " + minSize + " entries");
        }
        return (ArrayNode) node;
    }

    protected List<String> textValues(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode value : array) {
                values.add(value.asText());
            }
        }
        return values;
    }

    /**
     * Collects the {@code id} of each element, failing on missing, blank or duplicate ids.
     */
    protected Set<String> uniqueIds(ArrayNode items, String what) {
        Set<String> ids = new HashSet<>();
        for (JsonNode item : items) {
            JsonNode id = item.get("id");
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                throw new ValidationException("Each " + what + " must have a non-empty string 'id'");
            }
            if (!ids.add(id.asText())) {
                throw new ValidationException(what + " IDs must be unique, found duplicate ID: " + id.asText());
            }
            JsonNode text = item.get("text");
            if (text == null || text.asText().isBlank()) {
                throw new ValidationException("Each " + what + " must have non-empty 'text'");
            }
        }
        return ids;
    }

    /**
     * Trimmed comparison, case-folded unless {@code caseSensitive}.
     */
    protected static boolean matches(String given, String accepted, boolean caseSensitive) {
        if (given == null || accepted == null) {
            return false;
        }
        String left = given.trim();
        String right = accepted.trim();
        return caseSensitive ? left.equals(right) : left.toLowerCase(Locale.ROOT).equals(right.toLowerCase(Locale.ROOT));
    }
}
