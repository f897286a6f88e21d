package uk.gegc.assessment.features.attempt.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentQuestion;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentStatus;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentQuestionRepository;
import uk.gegc.assessment.features.assessment.domain.repository.AssessmentRepository;
import uk.gegc.assessment.features.attempt.api.dto.AnswerDto;
import uk.gegc.assessment.features.attempt.api.dto.AnswerSubmissionRequest;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.api.dto.SubmitAttemptRequest;
import uk.gegc.assessment.features.attempt.api.dto.TimeRemainingDto;
import uk.gegc.assessment.features.attempt.application.AttemptDetailAssembler;
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
import uk.gegc.assessment.features.question.domain.model.Question;
import uk.gegc.assessment.features.question.domain.model.QuestionType;
import uk.gegc.assessment.features.question.domain.repository.AnswerRepository;
import uk.gegc.assessment.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.assessment.features.question.infra.handler.EssayHandler;
import uk.gegc.assessment.features.question.infra.handler.MultipleChoiceHandler;
import uk.gegc.assessment.features.question.infra.handler.TrueFalseHandler;
import uk.gegc.assessment.features.randomization.application.RandomizationService;
import uk.gegc.assessment.features.user.domain.model.RoleName;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.exception.AttemptAlreadySubmittedException;
import uk.gegc.assessment.shared.exception.AttemptCannotStartException;
import uk.gegc.assessment.shared.exception.ForbiddenException;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;
import uk.gegc.assessment.shared.exception.TimeExpiredException;
import uk.gegc.assessment.shared.exception.ValidationException;
import uk.gegc.assessment.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("AttemptServiceImpl")
class AttemptServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private AttemptRepository attemptRepository;
    @Mock
    private AnswerRepository answerRepository;
    @Mock
    private AssessmentRepository assessmentRepository;
    @Mock
    private AssessmentQuestionRepository assessmentQuestionRepository;
    @Mock
    private RandomizationService randomizationService;
    @Mock
    private AttemptDetailAssembler detailAssembler;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ObjectMapper objectMapper;
    private AttemptServiceImpl service;

    private User student;
    private User teacher;
    private Assessment assessment;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        QuestionContentCodec codec = new QuestionContentCodec(objectMapper);
        ScoringEngine scoringEngine = new ScoringEngine(new QuestionHandlerFactory(List.of(
                new TrueFalseHandler(), new MultipleChoiceHandler(), new EssayHandler())));

        service = new AttemptServiceImpl(
                attemptRepository,
                answerRepository,
                assessmentRepository,
                assessmentQuestionRepository,
                scoringEngine,
                codec,
                randomizationService,
                detailAssembler,
                new AttemptMapper(codec),
                new AccessPolicy(),
                eventPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC),
                transactionManager
        );

        student = user(RoleName.STUDENT);
        teacher = user(RoleName.TEACHER);

        assessment = new Assessment();
        assessment.setId(UUID.randomUUID());
        assessment.setTitle("Algebra");
        assessment.setStatus(AssessmentStatus.ACTIVE);
        assessment.setDurationMinutes(60);
        assessment.setPassingScore(50);
        assessment.setMaxAttempts(1);
        assessment.setCreatedBy(teacher.getId());
    }

    private static User user(RoleName role) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername(role.name().toLowerCase() + "-" + UUID.randomUUID());
        user.setRole(role);
        return user;
    }

    private Attempt attempt(AttemptStatus status, Instant startedAt) {
        Attempt attempt = new Attempt();
        attempt.setId(UUID.randomUUID());
        attempt.setUser(student);
        attempt.setAssessment(assessment);
        attempt.setAttemptNumber(1);
        attempt.setStatus(status);
        attempt.setStartedAt(startedAt);
        attempt.setEndsAt(startedAt.plusSeconds(3600));
        attempt.setTotalQuestions(2);
        return attempt;
    }

    private Attempt activeAttempt() {
        Attempt attempt = attempt(AttemptStatus.IN_PROGRESS, NOW.minusSeconds(600));
        lenient().when(attemptRepository.findByIdWithAssessmentAndUser(attempt.getId())).thenReturn(Optional.of(attempt));
        return attempt;
    }

    private Attempt expiredAttempt() {
        Attempt attempt = attempt(AttemptStatus.IN_PROGRESS, NOW.minusSeconds(4000));
        lenient().when(attemptRepository.findByIdWithAssessmentAndUser(attempt.getId())).thenReturn(Optional.of(attempt));
        return attempt;
    }

    private AssessmentQuestion assessmentQuestion(QuestionType type, String content, int points, int order) {
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setType(type);
        question.setQuestionText("Question " + order);
        question.setContent(content);

        AssessmentQuestion aq = new AssessmentQuestion();
        aq.setId(UUID.randomUUID());
        aq.setAssessment(assessment);
        aq.setQuestion(question);
        aq.setPoints(points);
        aq.setQuestionOrder(order);
        return aq;
    }

    private void stubSaveReturnsArgument() {
        when(attemptRepository.save(any(Attempt.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("startAttempt")
    class StartAttempt {

        private void stubStartableAssessment(long previousAttempts, List<AssessmentQuestion> questions) {
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
            when(assessmentQuestionRepository.countByAssessmentId(assessment.getId())).thenReturn((long) questions.size());
            when(assessmentQuestionRepository.sumPointsByAssessmentId(assessment.getId()))
                    .thenReturn(questions.stream().mapToLong(AssessmentQuestion::getPoints).sum());
            when(attemptRepository.countByUserIdAndAssessmentId(student.getId(), assessment.getId())).thenReturn(previousAttempts);
            when(assessmentQuestionRepository.findByAssessmentIdWithQuestions(assessment.getId())).thenReturn(questions);
            when(attemptRepository.saveAndFlush(any(Attempt.class))).thenAnswer(inv -> {
                Attempt saved = inv.getArgument(0);
                saved.setId(UUID.randomUUID());
                return saved;
            });
        }

        @Test
        @DisplayName("creates an attempt with one empty answer per question and initializes seeds")
        void createsAttempt() {
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.empty());
            stubStartableAssessment(0, List.of(
                    assessmentQuestion(QuestionType.TRUE_FALSE, "{\"correctAnswer\":true}", 4, 1),
                    assessmentQuestion(QuestionType.ESSAY, "{}", 6, 2)));

            AttemptDto dto = service.startAttempt(assessment.getId(), student, null, new ClientInfo("10.0.0.1", "JUnit"));

            assertThat(dto.status()).isEqualTo(AttemptStatus.IN_PROGRESS);
            assertThat(dto.attemptNumber()).isEqualTo(1);
            assertThat(dto.startedAt()).isEqualTo(NOW);
            assertThat(dto.endsAt()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(dto.totalQuestions()).isEqualTo(2);
            assertThat(dto.timeRemainingSeconds()).isEqualTo(3600);

            ArgumentCaptor<Attempt> captor = ArgumentCaptor.forClass(Attempt.class);
            verify(attemptRepository).saveAndFlush(captor.capture());
            Attempt created = captor.getValue();
            assertThat(created.getIpAddress()).isEqualTo("10.0.0.1");
            assertThat(created.getAnswers()).hasSize(2)
                    .allSatisfy(answer -> {
                        assertThat(answer.getResponse()).isNull();
                        assertThat(answer.isGraded()).isFalse();
                    });
            assertThat(created.getAnswers()).extracting(Answer::getMaxScore).containsExactly(4.0, 6.0);
            verify(randomizationService).initializeSeeds(created);
        }

        @Test
        @DisplayName("returns the unexpired attempt already in progress instead of creating another")
        void resumesExisting() {
            Attempt existing = attempt(AttemptStatus.IN_PROGRESS, NOW.minusSeconds(60));
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.of(existing));

            AttemptDto first = service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN);
            AttemptDto second = service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN);

            assertThat(first.attemptId()).isEqualTo(existing.getId());
            assertThat(second.attemptId()).isEqualTo(existing.getId());
            verify(attemptRepository, never()).saveAndFlush(any());
            verify(attemptRepository, never()).countByUserIdAndAssessmentId(any(), any());
        }

        @Test
        @DisplayName("an attempt in progress is not handed back once the assessment closes")
        void closedAssessmentRefusesResume() {
            assessment.setStatus(AssessmentStatus.DRAFT);
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));

            assertThatThrownBy(() -> service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN))
                    .isInstanceOf(AttemptCannotStartException.class)
                    .hasMessageContaining("not active");
            verify(attemptRepository, never()).findByUserIdAndAssessmentIdAndStatus(any(), any(), any());
        }

        @Test
        @DisplayName("times out an expired attempt in progress and then starts a new one")
        void expiredExistingIsTimedOut() {
            assessment.setMaxAttempts(2);
            Attempt stale = attempt(AttemptStatus.IN_PROGRESS, NOW.minusSeconds(7200));
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.of(stale));
            stubSaveReturnsArgument();
            stubStartableAssessment(1, List.of(assessmentQuestion(QuestionType.TRUE_FALSE, "{\"correctAnswer\":true}", 5, 1)));

            AttemptDto dto = service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN);

            assertThat(stale.getStatus()).isEqualTo(AttemptStatus.TIMEOUT);
            assertThat(stale.getEndReason()).isEqualTo(AttemptEndReason.TIME_OUT);
            assertThat(stale.getTimeSpentSeconds()).isEqualTo(3600);
            verify(eventPublisher).publishEvent(any(AttemptFinalizedEvent.class));
            assertThat(dto.attemptId()).isNotEqualTo(stale.getId());
            assertThat(dto.attemptNumber()).isEqualTo(2);
        }

        @Test
        @DisplayName("refuses a second attempt when maxAttempts is 1")
        void maxAttemptsReached() {
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.empty());
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
            when(assessmentQuestionRepository.countByAssessmentId(assessment.getId())).thenReturn(1L);
            when(assessmentQuestionRepository.sumPointsByAssessmentId(assessment.getId())).thenReturn(10L);
            when(attemptRepository.countByUserIdAndAssessmentId(student.getId(), assessment.getId())).thenReturn(1L);

            assertThatThrownBy(() -> service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN))
                    .isInstanceOf(AttemptCannotStartException.class)
                    .hasMessageContaining("Maximum attempts (1)");
            verify(attemptRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("refuses inactive and past-due assessments")
        void inactiveOrPastDue() {
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));

            assessment.setStatus(AssessmentStatus.DRAFT);
            assertThatThrownBy(() -> service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN))
                    .isInstanceOf(AttemptCannotStartException.class)
                    .hasMessageContaining("not active");

            assessment.setStatus(AssessmentStatus.ACTIVE);
            assessment.setDueDate(NOW.minusSeconds(1));
            assertThatThrownBy(() -> service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN))
                    .isInstanceOf(AttemptCannotStartException.class)
                    .hasMessageContaining("due date");
        }

        @Test
        @DisplayName("refuses assessments worth more than 100 points")
        void tooManyPoints() {
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.empty());
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
            when(assessmentQuestionRepository.countByAssessmentId(assessment.getId())).thenReturn(3L);
            when(assessmentQuestionRepository.sumPointsByAssessmentId(assessment.getId())).thenReturn(101L);

            assertThatThrownBy(() -> service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN))
                    .isInstanceOf(AttemptCannotStartException.class);
        }

        @Test
        @DisplayName("losing a concurrent start returns the winner's attempt")
        void concurrentStart() {
            Attempt winner = attempt(AttemptStatus.IN_PROGRESS, NOW);
            when(attemptRepository.findByUserIdAndAssessmentIdAndStatus(student.getId(), assessment.getId(), AttemptStatus.IN_PROGRESS))
                    .thenReturn(Optional.empty(), Optional.of(winner));
            when(assessmentRepository.findById(assessment.getId())).thenReturn(Optional.of(assessment));
            when(assessmentQuestionRepository.countByAssessmentId(assessment.getId())).thenReturn(1L);
            when(assessmentQuestionRepository.sumPointsByAssessmentId(assessment.getId())).thenReturn(1L);
            when(attemptRepository.countByUserIdAndAssessmentId(student.getId(), assessment.getId())).thenReturn(0L);
            when(assessmentQuestionRepository.findByAssessmentIdWithQuestions(assessment.getId()))
                    .thenReturn(List.of(assessmentQuestion(QuestionType.TRUE_FALSE, "{\"correctAnswer\":true}", 1, 1)));
            when(attemptRepository.saveAndFlush(any(Attempt.class)))
                    .thenThrow(new DataIntegrityViolationException("uq_attempts_active"));

            AttemptDto dto = service.startAttempt(assessment.getId(), student, null, ClientInfo.UNKNOWN);

            assertThat(dto.attemptId()).isEqualTo(winner.getId());
        }
    }

    @Nested
    @DisplayName("submitAnswer")
    class SubmitAnswer {

        private Answer existingAnswer(Attempt attempt, QuestionType type) {
            Question question = new Question();
            question.setId(UUID.randomUUID());
            question.setType(type);
            Answer answer = new Answer();
            answer.setId(UUID.randomUUID());
            answer.setAttempt(attempt);
            answer.setQuestion(question);
            answer.setMaxScore(5.0);
            when(answerRepository.findByAttemptIdAndQuestionId(attempt.getId(), question.getId()))
                    .thenReturn(Optional.of(answer));
            return answer;
        }

        @Test
        @DisplayName("stores the payload, appends history and withholds grading fields")
        void savesAnswer() throws Exception {
            Attempt attempt = activeAttempt();
            Answer answer = existingAnswer(attempt, QuestionType.TRUE_FALSE);
            answer.setGraded(true);
            answer.setScore(5.0);
            when(answerRepository.save(answer)).thenReturn(answer);
            when(answerRepository.countAnsweredByAttemptId(attempt.getId())).thenReturn(1L);
            stubSaveReturnsArgument();

            JsonNode payload = objectMapper.readTree("{\"answer\":true}");
            AnswerDto dto = service.submitAnswer(attempt.getId(),
                    new AnswerSubmissionRequest(answer.getQuestion().getId(), payload, 30L, 1), student);

            assertThat(objectMapper.readTree(answer.getResponse())).isEqualTo(payload);
            assertThat(objectMapper.readTree(answer.getHistory()).size()).isEqualTo(1);
            assertThat(answer.isGraded()).isFalse();
            assertThat(answer.getScore()).isZero();
            assertThat(answer.getTimeSpentSeconds()).isEqualTo(30);
            assertThat(answer.getFirstAnsweredAt()).isEqualTo(NOW);
            assertThat(attempt.getQuestionsAnswered()).isEqualTo(1);
            assertThat(attempt.getCurrentQuestionIndex()).isEqualTo(1);
            assertThat(dto.score()).isNull();
            assertThat(dto.isCorrect()).isNull();
        }

        @Test
        @DisplayName("an empty payload clears the answer")
        void emptyPayloadClears() throws Exception {
            Attempt attempt = activeAttempt();
            Answer answer = existingAnswer(attempt, QuestionType.TRUE_FALSE);
            answer.setResponse("{\"answer\":true}");
            when(answerRepository.save(answer)).thenReturn(answer);
            stubSaveReturnsArgument();

            service.submitAnswer(attempt.getId(),
                    new AnswerSubmissionRequest(answer.getQuestion().getId(), objectMapper.createObjectNode(), null, null),
                    student);

            assertThat(answer.getResponse()).isNull();
        }

        @Test
        @DisplayName("a payload of the wrong shape is rejected before anything is stored")
        void malformedPayload() throws Exception {
            Attempt attempt = activeAttempt();
            Answer answer = existingAnswer(attempt, QuestionType.TRUE_FALSE);

            JsonNode payload = objectMapper.readTree("{\"answer\":\"yes\"}");
            assertThatThrownBy(() -> service.submitAnswer(attempt.getId(),
                    new AnswerSubmissionRequest(answer.getQuestion().getId(), payload, null, null), student))
                    .isInstanceOf(ValidationException.class);
            verify(answerRepository, never()).save(any());
        }

        @Test
        @DisplayName("after the deadline the attempt is timed out and the save fails")
        void afterDeadline() throws Exception {
            Attempt attempt = expiredAttempt();
            stubSaveReturnsArgument();

            JsonNode payload = objectMapper.readTree("{\"answer\":true}");
            assertThatThrownBy(() -> service.submitAnswer(attempt.getId(),
                    new AnswerSubmissionRequest(UUID.randomUUID(), payload, null, null), student))
                    .isInstanceOf(TimeExpiredException.class);

            assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.TIMEOUT);
            verify(eventPublisher).publishEvent(any(AttemptFinalizedEvent.class));
            verify(answerRepository, never()).save(any());
        }

        @Test
        @DisplayName("another student cannot answer")
        void notOwner() throws Exception {
            Attempt attempt = activeAttempt();
            User intruder = user(RoleName.STUDENT);

            assertThatThrownBy(() -> service.submitAnswer(attempt.getId(),
                    new AnswerSubmissionRequest(UUID.randomUUID(), objectMapper.readTree("{\"answer\":true}"), null, null),
                    intruder))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("submitAttempt")
    class SubmitAttempt {

        @Test
        @DisplayName("completes the attempt and publishes the finalized and closed events")
        void completes() {
            Attempt attempt = activeAttempt();
            when(answerRepository.countAnsweredByAttemptId(attempt.getId())).thenReturn(2L);
            stubSaveReturnsArgument();

            AttemptDto dto = service.submitAttempt(attempt.getId(), new SubmitAttemptRequest(null), student);

            assertThat(dto.status()).isEqualTo(AttemptStatus.COMPLETED);
            assertThat(dto.endReason()).isEqualTo(AttemptEndReason.SUBMITTED);
            assertThat(dto.completedAt()).isEqualTo(NOW);
            assertThat(dto.timeSpentSeconds()).isEqualTo(600);
            assertThat(dto.questionsAnswered()).isEqualTo(2);
            assertThat(dto.graded()).isFalse();

            ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(eventPublisher, times(2)).publishEvent(events.capture());
            assertThat(events.getAllValues())
                    .hasExactlyElementsOfTypes(AttemptFinalizedEvent.class, AttemptClosedEvent.class);
        }

        @Test
        @DisplayName("submitting twice fails with AttemptAlreadySubmitted")
        void twice() {
            Attempt attempt = activeAttempt();
            when(answerRepository.countAnsweredByAttemptId(attempt.getId())).thenReturn(0L);
            stubSaveReturnsArgument();

            service.submitAttempt(attempt.getId(), null, student);

            assertThatThrownBy(() -> service.submitAttempt(attempt.getId(), null, student))
                    .isInstanceOf(AttemptAlreadySubmittedException.class);
            verify(eventPublisher, times(1)).publishEvent(any(AttemptFinalizedEvent.class));
        }

        @Test
        @DisplayName("after the deadline the attempt becomes TIMEOUT and the call fails")
        void afterDeadline() {
            Attempt attempt = expiredAttempt();
            stubSaveReturnsArgument();

            assertThatThrownBy(() -> service.submitAttempt(attempt.getId(), null, student))
                    .isInstanceOf(TimeExpiredException.class);

            assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.TIMEOUT);
            assertThat(attempt.getTimeSpentSeconds()).isEqualTo(3600);
            verify(attemptRepository).save(attempt);
        }
    }

    @Nested
    @DisplayName("abandon and timeout")
    class Termination {

        @Test
        @DisplayName("abandon ends the attempt without requesting grading")
        void abandon() {
            Attempt attempt = activeAttempt();
            stubSaveReturnsArgument();

            AttemptDto dto = service.abandonAttempt(attempt.getId(), student);

            assertThat(dto.status()).isEqualTo(AttemptStatus.ABANDONED);
            verify(eventPublisher).publishEvent(any(AttemptClosedEvent.class));
            verify(eventPublisher, never()).publishEvent(any(AttemptFinalizedEvent.class));
        }

        @Test
        @DisplayName("abandoning a finished attempt is an invalid state")
        void abandonFinished() {
            Attempt attempt = activeAttempt();
            attempt.setStatus(AttemptStatus.COMPLETED);

            assertThatThrownBy(() -> service.abandonAttempt(attempt.getId(), student))
                    .isInstanceOf(InvalidAttemptStateException.class);
        }

        @Test
        @DisplayName("handleTimeout moves an attempt in progress to TIMEOUT exactly once")
        void handleTimeout() {
            Attempt attempt = expiredAttempt();
            stubSaveReturnsArgument();

            assertThat(service.handleTimeout(attempt.getId())).isTrue();
            assertThat(service.handleTimeout(attempt.getId())).isFalse();

            assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.TIMEOUT);
            verify(attemptRepository, times(1)).save(attempt);
            verify(eventPublisher, times(1)).publishEvent(any(AttemptFinalizedEvent.class));
        }
    }

    @Nested
    @DisplayName("extendTime")
    class ExtendTime {

        @Test
        @DisplayName("the assessment's teacher moves the deadline")
        void movesDeadline() {
            Attempt attempt = activeAttempt();
            stubSaveReturnsArgument();

            AttemptDto dto = service.extendTime(attempt.getId(), 15, teacher);

            assertThat(dto.endsAt()).isEqualTo(NOW.minusSeconds(600).plusSeconds(3600 + 900));
            assertThat(dto.timeRemainingSeconds()).isEqualTo(3000 + 900);
        }

        @Test
        @DisplayName("students and teachers of other assessments are refused")
        void forbidden() {
            Attempt attempt = activeAttempt();

            assertThatThrownBy(() -> service.extendTime(attempt.getId(), 15, student))
                    .isInstanceOf(ForbiddenException.class);
            assertThatThrownBy(() -> service.extendTime(attempt.getId(), 15, user(RoleName.TEACHER)))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("non-positive minutes are rejected")
        void nonPositive() {
            assertThatThrownBy(() -> service.extendTime(UUID.randomUUID(), 0, teacher))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("getAttemptDetail review mode")
    class ReviewMode {

        @Test
        @DisplayName("owner mid-attempt never sees correctness data")
        void ownerInProgress() {
            assessment.setShowCorrectAnswers(true);
            Attempt attempt = activeAttempt();

            service.getAttemptDetail(attempt.getId(), student);

            verify(detailAssembler).assemble(eq(attempt), anyList(), anyList(), eq(student), eq(false));
        }

        @Test
        @DisplayName("owner of a completed attempt sees it only when the assessment allows")
        void ownerCompleted() {
            Attempt attempt = activeAttempt();
            attempt.setStatus(AttemptStatus.COMPLETED);

            service.getAttemptDetail(attempt.getId(), student);
            verify(detailAssembler).assemble(eq(attempt), anyList(), anyList(), eq(student), eq(false));

            assessment.setShowCorrectAnswers(true);
            service.getAttemptDetail(attempt.getId(), student);
            verify(detailAssembler).assemble(eq(attempt), anyList(), anyList(), eq(student), eq(true));
        }

        @Test
        @DisplayName("the assessment's teacher always reviews")
        void grader() {
            Attempt attempt = activeAttempt();

            service.getAttemptDetail(attempt.getId(), teacher);

            verify(detailAssembler).assemble(eq(attempt), anyList(), anyList(), eq(teacher), eq(true));
        }

        @Test
        @DisplayName("an overdue attempt is timed out before the view is built")
        void overdue() {
            Attempt attempt = expiredAttempt();
            stubSaveReturnsArgument();

            service.getAttemptDetail(attempt.getId(), student);

            assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.TIMEOUT);
            verify(detailAssembler).assemble(eq(attempt), anyList(), anyList(), eq(student), eq(false));
        }
    }

    @Test
    @DisplayName("getTimeRemaining reports zero once the deadline has passed")
    void timeRemaining() {
        Attempt active = activeAttempt();
        Attempt expired = expiredAttempt();
        stubSaveReturnsArgument();

        TimeRemainingDto running = service.getTimeRemaining(active.getId(), student);
        TimeRemainingDto over = service.getTimeRemaining(expired.getId(), student);

        assertThat(running.secondsRemaining()).isEqualTo(3000);
        assertThat(running.status()).isEqualTo(AttemptStatus.IN_PROGRESS);
        assertThat(over.secondsRemaining()).isZero();
        assertThat(over.status()).isEqualTo(AttemptStatus.TIMEOUT);
    }
}
