package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import java.util.List;
import java.util.Locale;

/**
 * Content: {@code {"acceptedAnswers":[..], "caseSensitive":false, "fuzzyMatching":true, "maxLength":100}}.
 * Answer: {@code {"text":"..."}}.
 *
 * <p>With fuzzy matching enabled, a near miss earns its normalised Levenshtein similarity
 * as partial credit, provided the similarity reaches {@link #FUZZY_THRESHOLD}.
 */
@Component
public class ShortAnswerHandler extends QuestionHandler {

    static final double FUZZY_THRESHOLD = 0.8;

    @Override
    public QuestionType supportedType() {
        return QuestionType.SHORT_ANSWER;
    }

    @Override
    public void validateContent(JsonNode content) throws ValidationException {
        ObjectNode root = requireObject(content, "question");
        requireArray(root, "acceptedAnswers", 1);
        if (root.has("maxLength") && root.get("maxLength").asInt() <= 0) {
            throw new ValidationException("SHORT_ANSWER maxLength must be positive");
        }
    }

    @Override
    public void validateAnswer(JsonNode answer) throws ValidationException {
        ObjectNode root = requireObject(answer, "answer");
        if (!root.path("text").isTextual()) {
            throw new ValidationException("SHORT_ANSWER answer requires 'text'");
        }
    }

    @Override
    protected ScoreResult doScore(JsonNode content, JsonNode answer) {
        String given = answer.get("text").asText();
        boolean caseSensitive = content.path("caseSensitive").asBoolean(false);
        List<String> accepted = textValues(content.get("acceptedAnswers"));

        for (String candidate : accepted) {
            if (matches(given, candidate, caseSensitive)) {
                return ScoreResult.CORRECT;
            }
        }

        if (content.path("fuzzyMatching").asBoolean(false)) {
            double best = 0.0;
            for (String candidate : accepted) {
                best = Math.max(best, similarity(given, candidate));
            }
            if (best >= FUZZY_THRESHOLD) {
                return new ScoreResult(best, false);
            }
        }
        return ScoreResult.INCORRECT;
    }

    @Override
    public String feedback(JsonNode content, JsonNode answer, boolean fullyCorrect, boolean revealCorrect) {
        if (fullyCorrect) {
            return "Correct answer!";
        }
        return "Your answer doesn't match the expected response. Please review the question.";
    }

    @Override
    protected List<String> correctnessFields() {
        return List.of("acceptedAnswers");
    }

    /**
     * {@code 1 - distance / longerLength} over trimmed, lower-cased input.
     */
    static double similarity(String a, String b) {
        String left = a.trim().toLowerCase(Locale.ROOT);
        String right = b.trim().toLowerCase(Locale.ROOT);
        if (left.equals(right)) {
            return 1.0;
        }
        int maxLen = Math.max(left.length(), right.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / maxLen;
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
