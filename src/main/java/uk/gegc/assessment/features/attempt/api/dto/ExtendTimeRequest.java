package uk.gegc.assessment.features.attempt.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

@Schema(name = "ExtendTimeRequest", description = "Extra time granted to an attempt in progress")
public record ExtendTimeRequest(
        @Schema(description = "Minutes to add", example = "10", requiredMode = Schema.RequiredMode.REQUIRED)
        @Min(value = 1, message = "Extension must be at least 1 minute")
        @Max(value = 180, message = "Extension must not exceed 180 minutes")
        int minutes
) {
}
