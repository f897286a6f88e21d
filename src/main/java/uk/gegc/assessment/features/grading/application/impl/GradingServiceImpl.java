package uk.gegc.assessment.features.grading.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentQuestion;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentQuestionRepository;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;
import uk.gegc.assessment.features.attempt.domain.repository.AttemptRepository;
import uk.gegc.assessment.features.grading.api.dto.AttemptGradingResult;
import uk.gegc.assessment.features.grading.api.dto.GradingResult;
import uk.gegc.assessment.features.grading.api.dto.ManualGradeRequest;
import uk.gegc.assessment.features.grading.application.GradingService;
import uk.gegc.assessment.features.grading.domain.event.AttemptGradedEvent;
import uk.gegc.assessment.features.grading.domain.event.ManualGradeRecordedEvent;
import uk.gegc.assessment.features.grading.domain.model.LetterGrade;
import uk.gegc.assessment.features.question.application.QuestionContentCodec;
import uk.gegc.assessment.features.question.application.ScoringEngine;
import uk.gegc.assessment.features.question.domain.model.Answer;
import uk.gegc.assessment.features.question.domain.model.Question;
import uk.gegc.assessment.features.question.domain.model.ScoreResult;
import uk.gegc.assessment.features.question.domain.repository.AnswerRepository;
import uk.gegc.assessment.features.question.domain.repository.QuestionRepository;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;
import uk.gegc.assessment.shared.exception.ValidationException;
import uk.gegc.assessment.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class GradingServiceImpl implements GradingService {

    private static final Set<AttemptStatus> REGRADEABLE = EnumSet.of(AttemptStatus.COMPLETED, AttemptStatus.TIMEOUT);

    private final AttemptRepository attemptRepository;
    private final AnswerRepository answerRepository;
    private final AssessmentRepository assessmentRepository;
    private final AssessmentQuestionRepository assessmentQuestionRepository;
    private final QuestionRepository questionRepository;
    private final ScoringEngine scoringEngine;
    private final QuestionContentCodec codec;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final TransactionTemplate perAttemptTransaction;

    public GradingServiceImpl(AttemptRepository attemptRepository,
                              AnswerRepository answerRepository,
                              AssessmentRepository assessmentRepository,
                              AssessmentQuestionRepository assessmentQuestionRepository,
                              QuestionRepository questionRepository,
                              ScoringEngine scoringEngine,
                              QuestionContentCodec codec,
                              AccessPolicy accessPolicy,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock,
                              PlatformTransactionManager transactionManager) {
        this.attemptRepository = attemptRepository;
        this.answerRepository = answerRepository;
        this.assessmentRepository = assessmentRepository;
        this.assessmentQuestionRepository = assessmentQuestionRepository;
        this.questionRepository = questionRepository;
        this.scoringEngine = scoringEngine;
        this.codec = codec;
        this.accessPolicy = accessPolicy;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.perAttemptTransaction = new TransactionTemplate(transactionManager);
        this.perAttemptTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Always opens its own transaction. The dispatcher may run this inline from an
     * after-commit listener, where joining the finished transaction would lose every write.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AttemptGradingResult autoGradeAttempt(UUID attemptId) {
        return grade(loadAttempt(attemptId));
    }

    @Override
    @Transactional
    public AttemptGradingResult gradeAttempt(UUID attemptId, User grader) {
        Attempt attempt = loadAttempt(attemptId);
        accessPolicy.requireGrader(grader, attempt.getAssessment());
        return grade(attempt);
    }

    @Override
    @Transactional
    public GradingResult manualGradeAnswer(UUID answerId, ManualGradeRequest request, User grader) {
        Answer answer = answerRepository.findById(answerId)
                .orElseThrow(() -> new ResourceNotFoundException("Answer " + answerId + " not found"));
        Attempt attempt = answer.getAttempt();
        Assessment assessment = attempt.getAssessment();
        accessPolicy.requireGrader(grader, assessment);

        if (!attempt.getStatus().isGradeable()) {
            throw new InvalidAttemptStateException(attempt.getId(), attempt.getStatus(), "grade answer");
        }

        UUID questionId = answer.getQuestion().getId();
        AssessmentQuestion aq = assessmentQuestionRepository.findByAssessmentIdAndQuestionId(assessment.getId(), questionId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Question " + questionId + " is not part of assessment " + assessment.getId()));
        double maxScore = aq.getPoints();
        double score = request.score() != null ? request.score() : -1;
        if (score < 0 || score > maxScore) {
            throw new ValidationException("Score must be between 0 and " + maxScore + " but was " + request.score());
        }

        answer.setScore(score);
        answer.setMaxScore(maxScore);
        answer.setIsCorrect(Double.compare(score, maxScore) == 0);
        answer.setGraded(true);
        answer.setGradedBy(grader.getId());
        answer.setGradedAt(clock.instant());
        answer.setFeedback(request.feedback());
        Answer saved = answerRepository.save(answer);

        eventPublisher.publishEvent(new ManualGradeRecordedEvent(this, saved.getId(), attempt.getId(), grader.getId()));
        log.info("Answer {} of attempt {} graded {}/{} by {}", answerId, attempt.getId(), score, maxScore, grader.getId());
        return GradingResult.from(saved);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean finalizeIfFullyGraded(UUID attemptId) {
        long ungraded = answerRepository.countUngradedByAttemptId(attemptId);
        if (ungraded > 0) {
            log.debug("Attempt {} still has {} ungraded answers", attemptId, ungraded);
            return false;
        }
        grade(loadAttempt(attemptId));
        return true;
    }

    @Override
    public Map<UUID, AttemptGradingResult> autoGradeAssessment(UUID assessmentId, User grader) {
        requireAssessmentGrader(assessmentId, grader);
        List<UUID> attemptIds = attemptRepository.findIdsByAssessmentIdAndStatusIn(
                assessmentId, EnumSet.of(AttemptStatus.COMPLETED));
        Map<UUID, AttemptGradingResult> results = gradeEach(attemptIds);
        log.info("Auto-graded assessment {}: {} of {} attempts", assessmentId, results.size(), attemptIds.size());
        return results;
    }

    @Override
    public List<GradingResult> reGradeQuestion(UUID questionId, User grader) {
        if (!questionRepository.existsById(questionId)) {
            throw new ResourceNotFoundException("Question " + questionId + " not found");
        }
        for (AssessmentQuestion aq : assessmentQuestionRepository.findByQuestionIdWithAssessment(questionId)) {
            accessPolicy.requireGrader(grader, aq.getAssessment());
        }

        List<UUID> attemptIds = attemptRepository.findIdsByQuestionIdAndStatusIn(questionId, REGRADEABLE);
        List<GradingResult> results = gradeEach(attemptIds).values().stream()
                .flatMap(r -> r.questions().stream())
                .filter(r -> r.questionId().equals(questionId))
                .toList();
        log.info("Re-graded question {} across {} attempts", questionId, attemptIds.size());
        return results;
    }

    @Override
    public Map<UUID, AttemptGradingResult> reGradeAssessment(UUID assessmentId, User grader) {
        requireAssessmentGrader(assessmentId, grader);
        List<UUID> attemptIds = attemptRepository.findIdsByAssessmentIdAndStatusIn(assessmentId, REGRADEABLE);
        Map<UUID, AttemptGradingResult> results = gradeEach(attemptIds);
        log.info("Re-graded assessment {}: {} of {} attempts", assessmentId, results.size(), attemptIds.size());
        return results;
    }

    /**
     * Grades each attempt in its own transaction. A failed attempt is logged and skipped.
     */
    private Map<UUID, AttemptGradingResult> gradeEach(Collection<UUID> attemptIds) {
        Map<UUID, AttemptGradingResult> results = new LinkedHashMap<>();
        for (UUID attemptId : attemptIds) {
            try {
                AttemptGradingResult result = perAttemptTransaction.execute(status -> grade(loadAttempt(attemptId)));
                results.put(attemptId, result);
            } catch (RuntimeException e) {
                log.error("Failed to grade attempt {}", attemptId, e);
            }
        }
        return results;
    }

    private AttemptGradingResult grade(Attempt attempt) {
        if (!attempt.getStatus().isGradeable()) {
            throw new InvalidAttemptStateException(attempt.getId(), attempt.getStatus(), "grade");
        }
        Assessment assessment = attempt.getAssessment();
        Instant now = clock.instant();

        Map<UUID, AssessmentQuestion> byQuestion = assessmentQuestionRepository
                .findByAssessmentIdWithQuestions(assessment.getId()).stream()
                .collect(Collectors.toMap(aq -> aq.getQuestion().getId(), Function.identity()));
        List<Answer> answers = answerRepository.findByAttemptIdWithQuestion(attempt.getId());

        List<GradingResult> results = new ArrayList<>(answers.size());
        double totalScore = 0.0;
        double maxTotalScore = 0.0;
        boolean pending = false;

        for (Answer answer : answers) {
            AssessmentQuestion aq = byQuestion.get(answer.getQuestion().getId());
            if (aq == null) {
                log.warn("Question {} of answer {} is no longer in assessment {}; skipped",
                        answer.getQuestion().getId(), answer.getId(), assessment.getId());
                continue;
            }
            double points = aq.getPoints();
            answer.setMaxScore(points);

            if (!answer.isManuallyGraded()) {
                scoreAnswer(answer, points, assessment.isShowCorrectAnswers(), now);
            }

            pending |= !answer.isGraded();
            totalScore += answer.getScore();
            maxTotalScore += points;
            results.add(GradingResult.from(answer));
        }

        double percentage = maxTotalScore > 0 ? 100.0 * totalScore / maxTotalScore : 0.0;
        boolean passed = percentage >= assessment.getPassingScore();

        attempt.setScore(totalScore);
        attempt.setMaxScore(maxTotalScore);
        attempt.setPercentage(percentage);
        attempt.setPassed(passed);
        attempt.setGraded(!pending);
        attempt.setGradedAt(now);

        answerRepository.saveAll(answers);
        attemptRepository.save(attempt);

        eventPublisher.publishEvent(new AttemptGradedEvent(this, attempt.getId(), assessment.getId(),
                attempt.getUser().getId(), percentage, passed, !pending));

        log.info("Graded attempt {}: {}/{} ({}%), passed={}, fullyGraded={}",
                attempt.getId(), totalScore, maxTotalScore, percentage, passed, !pending);

        return new AttemptGradingResult(
                attempt.getId(),
                totalScore,
                maxTotalScore,
                percentage,
                passed,
                LetterGrade.fromPercentage(percentage).label(),
                !pending,
                results,
                now
        );
    }

    /**
     * An empty response is graded as wrong. Manual-only types and answers that fail to score
     * are left ungraded with no points.
     */
    private void scoreAnswer(Answer answer, double points, boolean revealCorrect, Instant now) {
        Question question = answer.getQuestion();
        answer.setGradedBy(null);

        JsonNode response;
        try {
            response = codec.read(answer.getResponse(), "answer " + answer.getId());
        } catch (ValidationException e) {
            log.warn("Answer {} holds malformed JSON; left ungraded", answer.getId(), e);
            markUngraded(answer);
            return;
        }

        if (QuestionContentCodec.isEmptyPayload(response)) {
            answer.setScore(0.0);
            answer.setIsCorrect(false);
            answer.setGraded(true);
            answer.setGradedAt(now);
            answer.setFeedback(null);
            return;
        }

        if (!question.getType().isAutoGradeable()) {
            markUngraded(answer);
            return;
        }

        try {
            JsonNode content = codec.read(question.getContent(), "question " + question.getId());
            ScoreResult result = scoringEngine.score(question.getType(), content, response);
            answer.setScore(result.ratio() * points);
            answer.setIsCorrect(result.fullyCorrect());
            answer.setGraded(true);
            answer.setGradedAt(now);
            answer.setFeedback(scoringEngine.feedback(question.getType(), content, response,
                    result.fullyCorrect(), revealCorrect));
        } catch (RuntimeException e) {
            log.warn("Scoring failed for answer {} ({} question {}); left ungraded",
                    answer.getId(), question.getType(), question.getId(), e);
            markUngraded(answer);
        }
    }

    private void markUngraded(Answer answer) {
        answer.setScore(0.0);
        answer.setIsCorrect(null);
        answer.setGraded(false);
        answer.setGradedAt(null);
    }

    private void requireAssessmentGrader(UUID assessmentId, User grader) {
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Assessment " + assessmentId + " not found"));
        accessPolicy.requireGrader(grader, assessment);
    }

    private Attempt loadAttempt(UUID attemptId) {
        return attemptRepository.findByIdWithAssessmentAndUser(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Attempt " + attemptId + " not found"));
    }
}
