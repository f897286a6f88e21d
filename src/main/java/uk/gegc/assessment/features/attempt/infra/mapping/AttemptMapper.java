package uk.gegc.assessment.features.attempt.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.attempt.api.dto.AnswerDto;
import uk.gegc.assessment.features.attempt.api.dto.AttemptDto;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.grading.domain.model.LetterGrade;
import uk.gegc.assessment.features.question.application.QuestionContentCodec;
import uk.gegc.assessment.features.question.domain.model.Answer;

@Component
@RequiredArgsConstructor
public class AttemptMapper {

    private final QuestionContentCodec codec;

    public AttemptDto toDto(Attempt attempt) {
        String letter = attempt.getPercentage() != null
                ? LetterGrade.fromPercentage(attempt.getPercentage()).label()
                : null;
        return new AttemptDto(
                attempt.getId(),
                attempt.getAssessment().getId(),
                attempt.getUser().getId(),
                attempt.getAttemptNumber(),
                attempt.getStatus(),
                attempt.getStartedAt(),
                attempt.getEndsAt(),
                attempt.getCompletedAt(),
                attempt.getTimeSpentSeconds(),
                attempt.getTimeRemainingSeconds(),
                attempt.getScore(),
                attempt.getMaxScore(),
                attempt.getPercentage(),
                attempt.getPassed(),
                attempt.isGraded(),
                letter,
                attempt.getCurrentQuestionIndex(),
                attempt.getQuestionsAnswered(),
                attempt.getTotalQuestions(),
                attempt.getEndReason()
        );
    }

    public AnswerDto toAnswerDto(Answer answer) {
        return new AnswerDto(
                answer.getId(),
                answer.getQuestion().getId(),
                codec.read(answer.getResponse(), "answer " + answer.getId()),
                answer.getScore(),
                answer.getMaxScore(),
                answer.getIsCorrect(),
                answer.isGraded(),
                answer.getFeedback(),
                answer.isFlagged(),
                answer.getTimeSpentSeconds(),
                answer.getLastModifiedAt()
        );
    }

    /**
     * Variant for a student mid-attempt: grading fields are withheld.
     */
    public AnswerDto toInProgressAnswerDto(Answer answer) {
        return new AnswerDto(
                answer.getId(),
                answer.getQuestion().getId(),
                codec.read(answer.getResponse(), "answer " + answer.getId()),
                null,
                null,
                null,
                false,
                null,
                answer.isFlagged(),
                answer.getTimeSpentSeconds(),
                answer.getLastModifiedAt()
        );
    }
}
