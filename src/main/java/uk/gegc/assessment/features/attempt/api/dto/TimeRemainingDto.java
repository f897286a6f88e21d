package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "TimeRemainingDto")
public record TimeRemainingDto(
        @Schema(description = "Attempt UUID") UUID attemptId,
        @Schema(description = "Status after the deadline check") AttemptStatus status,
        @Schema(description = "Deadline (UTC)") Instant endsAt,
        @Schema(description = "Seconds left, never negative") long secondsRemaining
) {
}
