package uk.gegc.assessment.features.attempt.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentQuestion;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentQuestionRepository;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.attempt.api.dto.AnswerDto;
import uk.gegc.assessment.features.attempt.api.dto.AnswerSubmissionRequest;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.StartAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.SubmitAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.TimeRemainingDto;
import uk.gegc.assessment.features.attempt.application.AttemptDetailAssembler;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.domain.event.AttemptClosedEvent;
import uk.gegc.assessment.features.attempt.domain.event.AttemptFinalizedEvent;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.attempt.domain.model.AttemptEndReason;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;
import uk.gegc.assessment.features.attempt.domain.model.ClientInfo;
import uk.gegc.assessment.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.assessment.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.assessment.features.question.application.QuestionContentCodec;
import uk.gegc.assessment.features.question.application.ScoringEngine;
import uk.gegc.assessment.features.question.domain.model.Answer;
import uk.gegc.assessment.features.question.domain.repository.AnswerRepository;
import uk.gegc.assessment.features.randomization.application.RandomizationService;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.exception.AttemptAlreadySubmittedException;
import uk.gegc.assessment.shared.exception.AttemptCannotStartException;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.TimeExpiredException;
import uk.gegc.assessment.shared.exception.ValidationException;
import uk.gegc.assessment.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Timeouts observed during a call are committed even though the call then fails with
 * {@link TimeExpiredException}, hence {@code noRollbackFor}.
 */
@Slf4j
@Service
@Transactional(noRollbackFor = TimeExpiredException.class)
public class AttemptServiceImpl implements AttemptService {

    private static final int MAX_TOTAL_POINTS = 100;

    private final AttemptRepository attemptRepository;
    private final AnswerRepository answerRepository;
    private final AssessmentRepository assessmentRepository;
    private final AssessmentQuestionRepository assessmentQuestionRepository;
    private final ScoringEngine scoringEngine;
    private final QuestionContentCodec codec;
    private final RandomizationService randomizationService;
    private final AttemptDetailAssembler detailAssembler;
    private final AttemptMapper attemptMapper;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public AttemptServiceImpl(AttemptRepository attemptRepository,
                              AnswerRepository answerRepository,
                              AssessmentRepository assessmentRepository,
                              AssessmentQuestionRepository assessmentQuestionRepository,
                              ScoringEngine scoringEngine,
                              QuestionContentCodec codec,
                              RandomizationService randomizationService,
                              AttemptDetailAssembler detailAssembler,
                              AttemptMapper attemptMapper,
                              AccessPolicy accessPolicy,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.attemptRepository = attemptRepository;
        this.answerRepository = answerRepository;
        this.assessmentRepository = assessmentRepository;
        this.assessmentQuestionRepository = assessmentQuestionRepository;
        this.scoringEngine = scoringEngine;
        this.codec = codec;
        this.randomizationService = randomizationService;
        this.detailAssembler = detailAssembler;
        this.attemptMapper = attemptMapper;
        this.accessPolicy = accessPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Runs in up to three short transactions: the first checks the assessment is open and
     * settles any attempt already in progress, the second creates the new one, and the third
     * picks up the winner when a concurrent start trips the single-active-attempt index.
     * A closed or past-due assessment refuses the start even when an attempt is in progress.
     */
    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public AttemptDto startAttempt(UUID assessmentId, User student, StartAttemptRequest request, ClientInfo clientInfo) {
        AttemptDto resumable = transactionTemplate.execute(status -> {
            loadOpenAssessment(assessmentId, clock.instant());
            return findResumable(assessmentId, student);
        });
        if (resumable != null) {
            return resumable;
        }

        try {
            return transactionTemplate.execute(status -> createAttempt(assessmentId, student, request, clientInfo));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent start for user {} on assessment {}; returning the active attempt",
                    student.getId(), assessmentId);
            return transactionTemplate.execute(status -> attemptRepository
                    .findByUserIdAndAssessmentIdAndStatus(student.getId(), assessmentId, AttemptStatus.IN_PROGRESS)
                    .map(attemptMapper::toDto)
                    .orElseThrow(() -> e));
        }
    }

    @Override
    public AttemptDetailDto resumeAttempt(UUID attemptId, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());
        ensureActive(attempt, "resume");
        return buildDetail(attempt, student, false);
    }

    @Override
    public AnswerDto submitAnswer(UUID attemptId, AnswerSubmissionRequest request, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());
        ensureActive(attempt, "submit answer");

        Answer saved = upsertAnswer(attempt, request, clock.instant());
        refreshProgress(attempt, request.currentQuestionIndex());
        attemptRepository.save(attempt);
        return attemptMapper.toInProgressAnswerDto(saved);
    }

    @Override
    public AttemptDto submitAttempt(UUID attemptId, SubmitAttemptRequest request, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());

        if (attempt.getStatus().isTerminal()) {
            throw new AttemptAlreadySubmittedException(attemptId);
        }
        Instant now = clock.instant();
        if (attempt.isExpired(now)) {
            timeoutAttempt(attempt, now);
            throw new TimeExpiredException(attemptId, attempt.getEndsAt());
        }

        List<AnswerSubmissionRequest> finalAnswers = request != null ? request.answers() : List.of();
        for (AnswerSubmissionRequest answerRequest : finalAnswers) {
            upsertAnswer(attempt, answerRequest, now);
        }
        refreshProgress(attempt, null);

        attempt.finish(AttemptStatus.COMPLETED, AttemptEndReason.SUBMITTED, now);
        Attempt saved = attemptRepository.save(attempt);
        publishFinalized(saved);

        log.info("Attempt {} submitted by user {} with {}/{} questions answered",
                attemptId, student.getId(), saved.getQuestionsAnswered(), saved.getTotalQuestions());
        return attemptMapper.toDto(saved);
    }

    @Override
    public AttemptDto abandonAttempt(UUID attemptId, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());
        ensureActive(attempt, "abandon");

        attempt.finish(AttemptStatus.ABANDONED, AttemptEndReason.ABANDONED, clock.instant());
        Attempt saved = attemptRepository.save(attempt);
        eventPublisher.publishEvent(new AttemptClosedEvent(this, attemptId));

        log.info("Attempt {} abandoned by user {}", attemptId, student.getId());
        return attemptMapper.toDto(saved);
    }

    @Override
    public boolean handleTimeout(UUID attemptId) {
        Attempt attempt = loadAttempt(attemptId);
        if (!attempt.isInProgress()) {
            log.debug("Attempt {} already {}; timeout ignored", attemptId, attempt.getStatus());
            return false;
        }
        timeoutAttempt(attempt, clock.instant());
        return true;
    }

    @Override
    public AttemptDto extendTime(UUID attemptId, int minutes, User grader) {
        if (minutes <= 0) {
            throw new ValidationException("Extension must be a positive number of minutes");
        }
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireGrader(grader, attempt.getAssessment());
        ensureActive(attempt, "extend time");

        Instant previous = attempt.getEndsAt();
        attempt.setEndsAt(previous.plus(Duration.ofMinutes(minutes)));
        attempt.setTimeRemainingSeconds(attempt.secondsRemaining(clock.instant()));
        Attempt saved = attemptRepository.save(attempt);

        log.info("Attempt {} extended by {} minutes by {}: deadline {} -> {}",
                attemptId, minutes, grader.getId(), previous, saved.getEndsAt());
        return attemptMapper.toDto(saved);
    }

    @Override
    public AttemptDetailDto getAttemptDetail(UUID attemptId, User requester) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwnerOrGrader(requester, attempt.getUser().getId(), attempt.getAssessment());

        expireIfOverdue(attempt);
        return buildDetail(attempt, requester, isReviewMode(attempt, requester));
    }

    @Override
    public TimeRemainingDto getTimeRemaining(UUID attemptId, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());

        Instant now = clock.instant();
        expireIfOverdue(attempt);
        long remaining = attempt.isInProgress() ? attempt.secondsRemaining(now) : 0;
        return new TimeRemainingDto(attemptId, attempt.getStatus(), attempt.getEndsAt(), remaining);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttemptDto> listAttempts(UUID assessmentId, User requester) {
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment " + assessmentId + " not found"));

        List<Attempt> attempts = accessPolicy.hasAssessmentAccess(requester, assessment)
                ? attemptRepository.findByAssessmentId(assessmentId)
                : attemptRepository.findByUserIdAndAssessmentId(requester.getId(), assessmentId);
        return attempts.stream()
                .map(attemptMapper::toDto)
                .toList();
    }

    @Override
    public AnswerDto flagAnswer(UUID attemptId, UUID questionId, boolean flagged, User student) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireOwner(student, attempt.getUser().getId());
        ensureActive(attempt, "flag answer");

        Answer answer = answerRepository.findByAttemptIdAndQuestionId(attemptId, questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No answer for question " + questionId + " in attempt " + attemptId));
        answer.setFlagged(flagged);
        return attemptMapper.toInProgressAnswerDto(answerRepository.save(answer));
    }

    private AttemptDto findResumable(UUID assessmentId, User student) {
        Optional<Attempt> active = attemptRepository.findByUserIdAndAssessmentIdAndStatus(
                student.getId(), assessmentId, AttemptStatus.IN_PROGRESS);
        if (active.isEmpty()) {
            return null;
        }
        Attempt attempt = active.get();
        Instant now = clock.instant();
        if (!attempt.isExpired(now)) {
            log.debug("Returning active attempt {} for user {}", attempt.getId(), student.getId());
            return attemptMapper.toDto(attempt);
        }
        timeoutAttempt(attempt, now);
        return null;
    }

    private Assessment loadOpenAssessment(UUID assessmentId, Instant now) {
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment " + assessmentId + " not found"));
        if (!assessment.isActive()) {
            throw new AttemptCannotStartException("Assessment " + assessmentId + " is not active");
        }
        if (assessment.isPastDue(now)) {
            throw new AttemptCannotStartException("Assessment " + assessmentId + " is past its due date");
        }
        return assessment;
    }

    private AttemptDto createAttempt(UUID assessmentId, User student, StartAttemptRequest request, ClientInfo clientInfo) {
        Instant now = clock.instant();
        Assessment assessment = loadOpenAssessment(assessmentId, now);

        if (assessmentQuestionRepository.countByAssessmentId(assessmentId) == 0) {
            throw new AttemptCannotStartException("Assessment " + assessmentId + " has no questions");
        }
        long totalPoints = assessmentQuestionRepository.sumPointsByAssessmentId(assessmentId);
        if (totalPoints > MAX_TOTAL_POINTS) {
            throw new AttemptCannotStartException(
                    "Assessment " + assessmentId + " assigns " + totalPoints + " points; at most " + MAX_TOTAL_POINTS + " allowed");
        }
        long previousAttempts = attemptRepository.countByUserIdAndAssessmentId(student.getId(), assessmentId);
        int maxAttempts = assessment.getMaxAttempts() != null ? assessment.getMaxAttempts() : 1;
        if (previousAttempts >= maxAttempts) {
            throw new AttemptCannotStartException("Maximum attempts (" + maxAttempts + ") reached for assessment " + assessmentId);
        }

        List<AssessmentQuestion> assessmentQuestions = assessmentQuestionRepository.findByAssessmentIdWithQuestions(assessmentId);
        ClientInfo client = clientInfo != null ? clientInfo : ClientInfo.UNKNOWN;

        Attempt attempt = new Attempt();
        attempt.setUser(student);
        attempt.setAssessment(assessment);
        attempt.setAttemptNumber((int) previousAttempts + 1);
        attempt.setStatus(AttemptStatus.IN_PROGRESS);
        attempt.setStartedAt(now);
        attempt.setEndsAt(now.plus(Duration.ofMinutes(assessment.getDurationMinutes())));
        attempt.setTimeRemainingSeconds(Duration.ofMinutes(assessment.getDurationMinutes()).getSeconds());
        attempt.setTotalQuestions(assessmentQuestions.size());
        attempt.setIpAddress(client.ipAddress());
        attempt.setUserAgent(client.userAgent());
        attempt.setSessionData(request != null ? codec.write(request.sessionData()) : null);

        for (AssessmentQuestion aq : assessmentQuestions) {
            Answer answer = new Answer();
            answer.setAttempt(attempt);
            answer.setQuestion(aq.getQuestion());
            answer.setMaxScore(aq.getPoints().doubleValue());
            attempt.getAnswers().add(answer);
        }

        Attempt saved = attemptRepository.saveAndFlush(attempt);
        randomizationService.initializeSeeds(saved);

        log.info("Started attempt {} (#{}) for user {} on assessment {}, deadline {}",
                saved.getId(), saved.getAttemptNumber(), student.getId(), assessmentId, saved.getEndsAt());
        return attemptMapper.toDto(saved);
    }

    private Answer upsertAnswer(Attempt attempt, AnswerSubmissionRequest request, Instant now) {
        if (request == null || request.questionId() == null) {
            throw new ValidationException("Answer must reference a question");
        }
        Answer answer = answerRepository.findByAttemptIdAndQuestionId(attempt.getId(), request.questionId())
                .orElseGet(() -> newAnswer(attempt, request.questionId()));

        JsonNode payload = request.response();
        boolean empty = QuestionContentCodec.isEmptyPayload(payload);
        if (!empty) {
            scoringEngine.validateAnswer(answer.getQuestion().getType(), payload);
        }

        answer.setResponse(empty ? null : codec.write(payload));
        appendHistory(answer, empty ? NullNode.getInstance() : payload, now);
        if (answer.getFirstAnsweredAt() == null && !empty) {
            answer.setFirstAnsweredAt(now);
        }
        answer.setLastModifiedAt(now);
        if (request.timeSpentSeconds() != null) {
            answer.setTimeSpentSeconds(answer.getTimeSpentSeconds() + request.timeSpentSeconds());
        }

        // A changed response invalidates any earlier grade
        answer.setScore(0.0);
        answer.setIsCorrect(null);
        answer.setGraded(false);
        answer.setGradedBy(null);
        answer.setGradedAt(null);
        answer.setFeedback(null);
        return answerRepository.save(answer);
    }

    private Answer newAnswer(Attempt attempt, UUID questionId) {
        AssessmentQuestion aq = assessmentQuestionRepository
                .findByAssessmentIdAndQuestionId(attempt.getAssessment().getId(), questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Question " + questionId + " is not part of assessment " + attempt.getAssessment().getId()));
        Answer answer = new Answer();
        answer.setAttempt(attempt);
        answer.setQuestion(aq.getQuestion());
        answer.setMaxScore(aq.getPoints().doubleValue());
        return answer;
    }

    private void appendHistory(Answer answer, JsonNode payload, Instant now) {
        JsonNode existing = codec.read(answer.getHistory(), "history of answer " + answer.getId());
        ArrayNode history = existing != null && existing.isArray()
                ? (ArrayNode) existing
                : codec.mapper().createArrayNode();
        ObjectNode entry = history.addObject();
        entry.set("answer", payload);
        entry.put("at", now.toString());
        answer.setHistory(codec.write(history));
    }

    private void refreshProgress(Attempt attempt, Integer currentQuestionIndex) {
        attempt.setQuestionsAnswered((int) answerRepository.countAnsweredByAttemptId(attempt.getId()));
        if (currentQuestionIndex != null) {
            if (currentQuestionIndex >= attempt.getTotalQuestions()) {
                throw new ValidationException("Question index " + currentQuestionIndex
                        + " is out of range for " + attempt.getTotalQuestions() + " questions");
            }
            attempt.setCurrentQuestionIndex(currentQuestionIndex);
        }
    }

    private void ensureActive(Attempt attempt, String operation) {
        if (!attempt.isInProgress()) {
            throw new InvalidAttemptStateException(attempt.getId(), attempt.getStatus(), operation);
        }
        Instant now = clock.instant();
        if (attempt.isExpired(now)) {
            timeoutAttempt(attempt, now);
            throw new TimeExpiredException(attempt.getId(), attempt.getEndsAt());
        }
    }

    private void expireIfOverdue(Attempt attempt) {
        Instant now = clock.instant();
        if (attempt.isInProgress() && attempt.isExpired(now)) {
            timeoutAttempt(attempt, now);
        }
    }

    private void timeoutAttempt(Attempt attempt, Instant now) {
        attempt.finish(AttemptStatus.TIMEOUT, AttemptEndReason.TIME_OUT, now);
        attemptRepository.save(attempt);
        publishFinalized(attempt);
        log.info("Attempt {} timed out; deadline was {}", attempt.getId(), attempt.getEndsAt());
    }

    private void publishFinalized(Attempt attempt) {
        eventPublisher.publishEvent(new AttemptFinalizedEvent(
                this,
                attempt.getId(),
                attempt.getAssessment().getId(),
                attempt.getUser().getId(),
                attempt.getStatus(),
                attempt.getEndReason(),
                attempt.getCompletedAt()
        ));
        eventPublisher.publishEvent(new AttemptClosedEvent(this, attempt.getId()));
    }

    /**
     * The owner never sees correctness data mid-attempt. Graders with access always do, and
     * the owner does after the attempt ends when the assessment allows it.
     */
    private boolean isReviewMode(Attempt attempt, User requester) {
        if (attempt.isInProgress() && accessPolicy.isOwner(requester, attempt.getUser().getId())) {
            return false;
        }
        if (accessPolicy.hasAssessmentAccess(requester, attempt.getAssessment())) {
            return true;
        }
        return attempt.getStatus().isGradeable() && attempt.getAssessment().isShowCorrectAnswers();
    }

    private AttemptDetailDto buildDetail(Attempt attempt, User requester, boolean reviewMode) {
        UUID assessmentId = attempt.getAssessment().getId();
        List<AssessmentQuestion> assessmentQuestions = assessmentQuestionRepository.findByAssessmentIdWithQuestions(assessmentId);
        List<Answer> answers = answerRepository.findByAttemptIdWithQuestion(attempt.getId());
        return detailAssembler.assemble(attempt, assessmentQuestions, answers, requester, reviewMode);
    }

    private Attempt loadAttempt(UUID attemptId) {
        return attemptRepository.findByIdWithAssessmentAndUser(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
    }
}
