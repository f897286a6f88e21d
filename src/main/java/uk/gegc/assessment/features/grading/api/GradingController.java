package uk.gegc.assessment.features.grading.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.assessment.features.grading.api.dto.AttemptGradingResult;
import uk.gegc.assessment.features.grading.api.dto.GradingResult;
import uk.gegc.assessment.features.grading.api.dto.ManualGradeRequest;
import uk.gegc.assessment.features.grading.application.GradingService;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.security.CurrentUserResolver;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Tag(name = "Grading", description = "Automatic and manual grading of attempts. Teachers and admins only.")
@RestController
@RequestMapping("/api/v1/grading")
@RequiredArgsConstructor
@Validated
public class GradingController {

    private final GradingService gradingService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(summary = "Grade an attempt now", description = "Runs automatic grading synchronously and returns per-question results.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt graded",
                    content = @Content(schema = @Schema(implementation = AttemptGradingResult.class))),
            @ApiResponse(responseCode = "403", description = "Caller may not grade this assessment",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Attempt is not completed or timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/attempts/{attemptId}")
    public ResponseEntity<AttemptGradingResult> gradeAttempt(
            @Parameter(description = "Attempt UUID", required = true) @PathVariable UUID attemptId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(gradingService.gradeAttempt(attemptId, grader));
    }

    @Operation(
            summary = "Grade an answer manually",
            description = "Score must lie between 0 and the question's points. The attempt total is recomputed in the background once nothing is left ungraded."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer graded",
                    content = @Content(schema = @Schema(implementation = GradingResult.class))),
            @ApiResponse(responseCode = "400", description = "Score out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/answers/{answerId}")
    public ResponseEntity<GradingResult> gradeAnswer(
            @PathVariable UUID answerId,
            @RequestBody @Valid ManualGradeRequest request,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(gradingService.manualGradeAnswer(answerId, request, grader));
    }

    @Operation(summary = "Grade all completed attempts of an assessment", description = "Attempts that fail to grade are skipped.")
    @PostMapping("/assessments/{assessmentId}")
    public ResponseEntity<Map<UUID, AttemptGradingResult>> gradeAssessment(
            @PathVariable UUID assessmentId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(gradingService.autoGradeAssessment(assessmentId, grader));
    }

    @Operation(summary = "Re-grade an assessment", description = "Re-applies automatic grading to every completed or timed-out attempt. Manual grades are kept.")
    @PostMapping("/assessments/{assessmentId}/regrade")
    public ResponseEntity<Map<UUID, AttemptGradingResult>> reGradeAssessment(
            @PathVariable UUID assessmentId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(gradingService.reGradeAssessment(assessmentId, grader));
    }

    @Operation(summary = "Re-grade a question", description = "Re-grades every finished attempt that answered the question, after a content or points correction.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answers re-graded",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = GradingResult.class))))
    })
    @PostMapping("/questions/{questionId}/regrade")
    public ResponseEntity<List<GradingResult>> reGradeQuestion(
            @PathVariable UUID questionId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(gradingService.reGradeQuestion(questionId, grader));
    }
}
