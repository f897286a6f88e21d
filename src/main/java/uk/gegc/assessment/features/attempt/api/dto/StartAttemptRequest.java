package uk.gegc.assessment.features.attempt.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "StartAttemptRequest", description = "Optional client metadata stored with a new attempt")
public record StartAttemptRequest(
        @Schema(description = "Free-form client session metadata", example = "{\"timezone\":\"Europe/London\"}")
        JsonNode sessionData
) {
}
