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
class MatchingHandlerTest {

    private MatchingHandler handler;
    private ObjectMapper mapper;
    private JsonNode content;

    @BeforeEach
    void setUp() throws Exception {
        handler = new MatchingHandler();
        mapper = new ObjectMapper();
        content = mapper.readTree("""
                {"leftItems":[{"id":"l1","text":"France"},{"id":"l2","text":"Spain"},{"id":"l3","text":"Italy"},{"id":"l4","text":"Peru"}],
                 "rightItems":[{"id":"r1","text":"Paris"},{"id":"r2","text":"Madrid"},{"id":"r3","text":"Rome"},{"id":"r4","text":"Lima"}],
                 "correctPairs":[{"leftId":"l1","rightId":"r1"},{"leftId":"l2","rightId":"r2"},
                                 {"leftId":"l3","rightId":"r3"},{"leftId":"l4","rightId":"r4"}]}
                """);
    }

    @Test
    void allPairsMatched_isCorrect() throws Exception {
        ScoreResult result = handler.score(content,
                mapper.readTree("{\"matches\":{\"l1\":\"r1\",\"l2\":\"r2\",\"l3\":\"r3\",\"l4\":\"r4\"}}"));
        assertTrue(result.fullyCorrect());
    }

    @Test
    void threeOfFourPairs_scoresThreeQuarters() throws Exception {
        ScoreResult result = handler.score(content,
                mapper.readTree("{\"matches\":{\"l1\":\"r1\",\"l2\":\"r2\",\"l3\":\"r3\",\"l4\":\"r1\"}}"));
        assertEquals(0.75, result.ratio(), 1e-9);
        assertFalse(result.fullyCorrect());
    }

    @Test
    void pairReferencingUnknownItem_throws() throws Exception {
        JsonNode bad = mapper.readTree("""
                {"leftItems":[{"id":"l1","text":"A"},{"id":"l2","text":"B"}],
                 "rightItems":[{"id":"r1","text":"1"},{"id":"r2","text":"2"}],
                 "correctPairs":[{"leftId":"l1","rightId":"r9"}]}
                """);
        assertThrows(ValidationException.class, () -> handler.validateContent(bad));
    }

    @Test
    void sanitize_removesCorrectPairs() {
        JsonNode sanitized = handler.sanitize(content);
        assertFalse(sanitized.has("correctPairs"));
        assertEquals(4, sanitized.get("rightItems").size());
    }
}
