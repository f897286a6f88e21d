package uk.gegc.assessment.features.question.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;

import static org.junit.jupiter.api.Assertions.*;

@Execution(ExecutionMode.CONCURRENT)
class ShortAnswerHandlerTest {

    private final ShortAnswerHandler handler = new ShortAnswerHandler();
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode content(boolean fuzzy) throws Exception {
        return mapper.readTree("{\"acceptedAnswers\":[\"photograph\"],\"fuzzyMatching\":" + fuzzy + "}");
    }

    private JsonNode answer(String text) {
        return mapper.createObjectNode().put("text", text);
    }

    @Test
    void exactMatch_ignoringCaseAndWhitespace_isCorrect() throws Exception {
        ScoreResult result = handler.score(content(false), answer("  PhotoGraph "));
        assertTrue(result.fullyCorrect());
        assertEquals(1.0, result.ratio());
    }

    @Test
    void oneEditOnTenCharacters_givesNinetyPercentWithFuzzyMatching() throws Exception {
        ScoreResult result = handler.score(content(true), answer("photogroph"));
        assertEquals(0.9, result.ratio(), 1e-9);
        assertFalse(result.fullyCorrect());
    }

    @Test
    void similarityBelowThreshold_givesNothing() throws Exception {
        // three substitutions: similarity 0.7
        ScoreResult result = handler.score(content(true), answer("phxtxgxaph"));
        assertEquals(0.0, result.ratio());
    }

    @Test
    void nearMissWithoutFuzzyMatching_givesNothing() throws Exception {
        ScoreResult result = handler.score(content(false), answer("photogroph"));
        assertEquals(0.0, result.ratio());
    }

    @Test
    void levenshtein_countsEdits() {
        assertEquals(3, ShortAnswerHandler.levenshtein("kitten", "sitting"));
        assertEquals(0, ShortAnswerHandler.levenshtein("same", "same"));
        assertEquals(4, ShortAnswerHandler.levenshtein("", "abcd"));
    }

    @Test
    void similarity_isNormalisedByLongerString() {
        assertEquals(0.9, ShortAnswerHandler.similarity("abcdefghij", "abcdefghiX"), 1e-9);
        assertEquals(1.0, ShortAnswerHandler.similarity("Same", " same"), 1e-9);
    }
}
