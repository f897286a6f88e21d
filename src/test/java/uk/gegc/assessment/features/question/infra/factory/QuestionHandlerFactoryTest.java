package uk.gegc.assessment.features.question.infra.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.infra.handler.*;
import uk.gegc.assessment.shared.exception.UnsupportedQuestionTypeException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
class QuestionHandlerFactoryTest {

    private static List<QuestionHandler> allHandlers() {
        return List.of(new MultipleChoiceHandler(), new TrueFalseHandler(), new EssayHandler(),
                new FillInBlankHandler(), new MatchingHandler(), new OrderingHandler(), new ShortAnswerHandler());
    }

    @Test
    @DisplayName("every question type resolves to the handler that declares it")
    void everyTypeHasAHandler() {
        QuestionHandlerFactory factory = new QuestionHandlerFactory(allHandlers());

        for (QuestionType type : QuestionType.values()) {
            assertThat(factory.getHandler(type).supportedType()).isEqualTo(type);
        }
    }

    @Test
    @DisplayName("missing handler: throws UnsupportedQuestionTypeException")
    void missingHandler() {
        QuestionHandlerFactory factory = new QuestionHandlerFactory(List.of(new TrueFalseHandler()));

        assertThatThrownBy(() -> factory.getHandler(QuestionType.ESSAY))
                .isInstanceOf(UnsupportedQuestionTypeException.class)
                .hasMessageContaining("ESSAY");
    }

    @Test
    @DisplayName("two handlers for one type: fails at construction")
    void duplicateHandlers() {
        assertThatThrownBy(() -> new QuestionHandlerFactory(List.of(new TrueFalseHandler(), new TrueFalseHandler())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TRUE_FALSE");
    }
}
