package uk.gegc.assessment.features.question.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.shared.exception.ValidationException;

/**
 * Converts the JSON columns of questions and answers to and from Jackson trees.
 */
@Component
@RequiredArgsConstructor
public class QuestionContentCodec {

    private final ObjectMapper objectMapper;

    public JsonNode read(String json, String what) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON in " + what, e);
        }
    }

    public String write(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON payload", e);
        }
    }

    /**
     * A payload counts as empty when it is absent, JSON null or an empty object, array or string.
     */
    public static boolean isEmptyPayload(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isContainerNode()) {
            return node.isEmpty();
        }
        return node.isTextual() && node.asText().isBlank();
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }
}
