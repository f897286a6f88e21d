package uk.gegc.assessment.features.attempt.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentQuestion;
import uk.gegc.assessment.features.attempt.api.dto.AnswerDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDetailDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptQuestionDto;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.attempt.infra.mapping.AttemptMapper;
import uk.gegc.assessment.features.question.application.AnswerSanitizer;
import uk.gegc.assessment.features.question.application.QuestionContentCodec;
import uk.gegc.assessment.features.question.application.QuestionContentShuffler;
import uk.gegc.assessment.features.question.domain.model.Answer;
import uk.gegc.assessment.features.question.domain.model.Question;
import uk.gegc.assessment.features.randomization.application.RandomizationService;
import uk.gegc.assessment.features.randomization.domain.model.ShufflePlan;
import uk.gegc.assessment.features.user.domain.model.User;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the attempt view for one requester.
 *
 * <p>Correctness data is stripped unless the caller passes {@code reviewMode}. Shuffling
 * follows the {@link ShufflePlan} for the requester, which is empty for anyone but the
 * owning student of an attempt in progress.
 */
@Component
@RequiredArgsConstructor
public class AttemptDetailAssembler {

    private final AnswerSanitizer answerSanitizer;
    private final QuestionContentShuffler contentShuffler;
    private final QuestionContentCodec codec;
    private final RandomizationService randomizationService;
    private final AttemptMapper attemptMapper;

    public AttemptDetailDto assemble(Attempt attempt,
                                     List<AssessmentQuestion> assessmentQuestions,
                                     List<Answer> answers,
                                     User requester,
                                     boolean reviewMode) {
        Map<UUID, Answer> answersByQuestion = answers.stream()
                .collect(Collectors.toMap(a -> a.getQuestion().getId(), Function.identity(), (a, b) -> a));

        ShufflePlan plan = randomizationService.planFor(attempt, requester);
        List<AssessmentQuestion> ordered = plan.shuffleQuestions()
                ? randomizationService.shuffle(assessmentQuestions, plan.questionSeed())
                : assessmentQuestions;

        boolean hideGrades = attempt.isInProgress();
        List<AttemptQuestionDto> questions = new ArrayList<>(ordered.size());
        for (AssessmentQuestion aq : ordered) {
            Question question = aq.getQuestion();
            JsonNode content = codec.read(question.getContent(), "question " + question.getId());
            if (!reviewMode) {
                content = answerSanitizer.sanitize(question.getType(), content);
            }
            if (plan.shuffleOptions()) {
                long seed = plan.optionSeedFor(question.getId());
                content = contentShuffler.shuffleContent(content, question.getType(), () -> new Random(seed));
            }

            Answer answer = answersByQuestion.get(question.getId());
            AnswerDto answerDto = null;
            if (answer != null) {
                answerDto = hideGrades ? attemptMapper.toInProgressAnswerDto(answer) : attemptMapper.toAnswerDto(answer);
            }

            questions.add(new AttemptQuestionDto(
                    question.getId(),
                    question.getType(),
                    question.getQuestionText(),
                    content,
                    aq.getPoints(),
                    aq.getQuestionOrder(),
                    reviewMode ? question.getExplanation() : null,
                    answerDto
            ));
        }
        return new AttemptDetailDto(attemptMapper.toDto(attempt), questions, reviewMode);
    }
}
