package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.shared.exception.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

@Execution(ExecutionMode.CONCURRENT)
class OrderingHandlerTest {

    private OrderingHandler handler;
    private ObjectMapper mapper;
    private JsonNode content;

    @BeforeEach
    void setUp() throws Exception {
        handler = new OrderingHandler();
        mapper = new ObjectMapper();
        content = mapper.readTree("""
                {"items":[{"id":"a","text":"Egg"},{"id":"b","text":"Larva"},{"id":"c","text":"Pupa"},{"id":"d","text":"Adult"}],
                 "correctOrder":["a","b","c","d"]}
                """);
    }

    @Test
    void exactSequence_isCorrect() throws Exception {
        ScoreResult result = handler.score(content, mapper.readTree("{\"orderedItemIds\":[\"a\",\"b\",\"c\",\"d\"]}"));
        assertTrue(result.fullyCorrect());
    }

    @Test
    void creditIsForAbsolutePositionOnly() throws Exception {
        // Same relative order shifted by one: no item sits in its expected slot
        ScoreResult shifted = handler.score(content, mapper.readTree("{\"orderedItemIds\":[\"d\",\"a\",\"b\",\"c\"]}"));
        assertEquals(0.0, shifted.ratio());

        ScoreResult swapped = handler.score(content, mapper.readTree("{\"orderedItemIds\":[\"a\",\"b\",\"d\",\"c\"]}"));
        assertEquals(0.5, swapped.ratio(), 1e-9);
        assertFalse(swapped.fullyCorrect());
    }

    @Test
    void correctOrderMissingAnItem_throws() throws Exception {
        JsonNode bad = mapper.readTree("""
                {"items":[{"id":"a","text":"A"},{"id":"b","text":"B"},{"id":"c","text":"C"}],"correctOrder":["a","b"]}
                """);
        assertThrows(ValidationException.class, () -> handler.validateContent(bad));
    }
}
