package uk.gegc.assessment.features.question.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.infra.handler.QuestionHandler;
import uk.gegc.assessment.shared.exception.UnsupportedQuestionTypeException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of question handlers keyed by type. Supporting a new type means adding one
 * {@link QuestionHandler} bean; nothing else dispatches on the type.
 */
@Component
@Slf4j
public class QuestionHandlerFactory {
    private final Map<QuestionType, QuestionHandler> handlerMap = new EnumMap<>(QuestionType.class);

    public QuestionHandlerFactory(List<QuestionHandler> handlers) {
        log.info("Initializing QuestionHandlerFactory with {} handlers", handlers.size());

        handlers.forEach(handler -> {
            QuestionHandler previous = handlerMap.put(handler.supportedType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for type " + handler.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        });

        log.info("QuestionHandlerFactory initialized with handlers for types: {}", handlerMap.keySet());
    }

    public QuestionHandler getHandler(QuestionType type) {
        QuestionHandler questionHandler = handlerMap.get(type);
        if (questionHandler == null) {
            throw new UnsupportedQuestionTypeException("No handler for type " + type);
        }
        return questionHandler;
    }
}
