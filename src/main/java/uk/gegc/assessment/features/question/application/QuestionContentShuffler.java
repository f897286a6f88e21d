package uk.gegc.assessment.features.question.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.infra.factory.QuestionHandlerFactory;

import java.util.Random;
import java.util.function.Supplier;

/**
 * Shuffles the option arrays of a question for display.
 *
 * <p>Multiple choice shuffles {@code options}, matching shuffles {@code rightItems} and
 * ordering shuffles {@code items}. Other types come back unchanged. The same
 * {@link Random} seed always yields the same arrangement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionContentShuffler {

    private final QuestionHandlerFactory handlerFactory;

    public JsonNode shuffleContent(JsonNode content, QuestionType questionType, Supplier<Random> randomSupplier) {
        if (content == null || !content.isObject()) {
            log.debug("Content is not a JSON object, skipping shuffle");
            return content;
        }
        ObjectNode copy = ((ObjectNode) content).deepCopy();
        handlerFactory.getHandler(questionType).shuffleOptions(copy, randomSupplier.get());
        return copy;
    }
}
