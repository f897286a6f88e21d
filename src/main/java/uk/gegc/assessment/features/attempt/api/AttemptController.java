package uk.gegc.assessment.features.attempt.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.assessment.features.attempt.api.dto.*;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.domain.model.ClientInfo;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.security.CurrentUserResolver;

import java.util.List;
import java.util.UUID;

@Tag(name = "Attempts", description = "Start, answer, submit and review assessment attempts")
@RestController
@RequestMapping("/api/v1/attempts")
@RequiredArgsConstructor
@Validated
public class AttemptController {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final AttemptService attemptService;
    private final CurrentUserResolver currentUserResolver;

    @Operation(
            summary = "Start an attempt",
            description = """
                    Creates an attempt for the assessment and seeds one empty answer per question.
                    When the caller already has an unexpired attempt in progress, that attempt is returned unchanged.
                    An expired one is timed out first.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Attempt started or resumed",
                    content = @Content(schema = @Schema(implementation = AttemptDto.class))),
            @ApiResponse(responseCode = "404", description = "Assessment not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Assessment inactive, past due or attempt limit reached",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class),
                            examples = @ExampleObject(name = "limit", value = """
                                    {
                                      "type":"https://assessments.gegc.uk/docs/errors/attempt-cannot-start",
                                      "title":"Attempt Cannot Start",
                                      "status":422,
                                      "detail":"Maximum attempts (1) reached for assessment 3fa85f64-5717-4562-b3fc-2c963f66afa6"
                                    }
                                    """)))
    })
    @PostMapping("/start/{assessmentId}")
    public ResponseEntity<AttemptDto> startAttempt(
            @Parameter(description = "Assessment UUID", required = true)
            @PathVariable UUID assessmentId,

            @RequestBody(required = false) @Valid StartAttemptRequest request,

            @Parameter(in = ParameterIn.HEADER, description = "Caller UUID")
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId,

            HttpServletRequest httpRequest
    ) {
        User student = currentUserResolver.resolve(userId);
        AttemptDto dto = attemptService.startAttempt(assessmentId, student, request, clientInfo(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @Operation(summary = "Resume an attempt", description = "Returns the sanitized attempt view. Fails with 410 once the deadline has passed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt view returned",
                    content = @Content(schema = @Schema(implementation = AttemptDetailDto.class))),
            @ApiResponse(responseCode = "409", description = "Attempt is not in progress",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Deadline passed; the attempt was timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{attemptId}/resume")
    public ResponseEntity<AttemptDetailDto> resumeAttempt(
            @PathVariable UUID attemptId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.resumeAttempt(attemptId, student));
    }

    @Operation(
            summary = "Save an answer",
            description = "Upserts the answer to one question. An empty payload clears the answer."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer saved",
                    content = @Content(schema = @Schema(implementation = AnswerDto.class))),
            @ApiResponse(responseCode = "400", description = "Malformed answer payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Deadline passed",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PutMapping("/{attemptId}/answers")
    public ResponseEntity<AnswerDto> submitAnswer(
            @PathVariable UUID attemptId,
            @RequestBody @Valid AnswerSubmissionRequest request,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.submitAnswer(attemptId, request, student));
    }

    @Operation(
            summary = "Submit an attempt",
            description = """
                    Saves any final answers and completes the attempt. Grading runs in the background:
                    poll the attempt until `graded` is true.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempt completed",
                    content = @Content(schema = @Schema(implementation = AttemptDto.class))),
            @ApiResponse(responseCode = "409", description = "Attempt already submitted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "410", description = "Deadline passed; the attempt was timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{attemptId}/submit")
    public ResponseEntity<AttemptDto> submitAttempt(
            @PathVariable UUID attemptId,
            @RequestBody(required = false) @Valid SubmitAttemptRequest request,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.submitAttempt(attemptId, request, student));
    }

    @Operation(summary = "Abandon an attempt", description = "Ends the attempt without grading.")
    @PostMapping("/{attemptId}/abandon")
    public ResponseEntity<AttemptDto> abandonAttempt(
            @PathVariable UUID attemptId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.abandonAttempt(attemptId, student));
    }

    @Operation(summary = "Extend the deadline", description = "Teachers and admins with access to the assessment only.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deadline moved",
                    content = @Content(schema = @Schema(implementation = AttemptDto.class))),
            @ApiResponse(responseCode = "403", description = "Caller may not grade this assessment",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{attemptId}/extend")
    public ResponseEntity<AttemptDto> extendTime(
            @PathVariable UUID attemptId,
            @RequestBody @Valid ExtendTimeRequest request,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User grader = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.extendTime(attemptId, request.minutes(), grader));
    }

    @Operation(
            summary = "Get attempt details",
            description = "Correctness data is included for graders, and for the owner after the attempt ends when the assessment allows it."
    )
    @GetMapping("/{attemptId}")
    public ResponseEntity<AttemptDetailDto> getAttemptDetail(
            @PathVariable UUID attemptId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User requester = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.getAttemptDetail(attemptId, requester));
    }

    @Operation(summary = "Get remaining time")
    @GetMapping("/{attemptId}/time-remaining")
    public ResponseEntity<TimeRemainingDto> getTimeRemaining(
            @PathVariable UUID attemptId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.getTimeRemaining(attemptId, student));
    }

    @Operation(summary = "List attempts for an assessment", description = "Graders see every attempt; students see their own.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Attempts returned",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = AttemptDto.class))))
    })
    @GetMapping
    public ResponseEntity<List<AttemptDto>> listAttempts(
            @Parameter(in = ParameterIn.QUERY, description = "Assessment UUID", required = true)
            @RequestParam(name = "assessmentId") UUID assessmentId,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User requester = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.listAttempts(assessmentId, requester));
    }

    @Operation(summary = "Flag a question for review")
    @PostMapping("/{attemptId}/answers/{questionId}/flag")
    public ResponseEntity<AnswerDto> flagAnswer(
            @PathVariable UUID attemptId,
            @PathVariable UUID questionId,
            @RequestBody @Valid FlagAnswerRequest request,
            @RequestHeader(value = CurrentUserResolver.USER_HEADER, required = false) UUID userId
    ) {
        User student = currentUserResolver.resolve(userId);
        return ResponseEntity.ok(attemptService.flagAnswer(attemptId, questionId, request.flagged(), student));
    }

    private ClientInfo clientInfo(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        String ip = forwarded != null && !forwarded.isBlank()
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        return new ClientInfo(ip, request.getHeader("User-Agent"));
    }
}
