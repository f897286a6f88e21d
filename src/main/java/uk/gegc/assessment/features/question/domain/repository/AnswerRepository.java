package uk.gegc.assessment.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.assessment.features.question.domain.model.Answer;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AnswerRepository extends JpaRepository<Answer, UUID> {

    @Query("""
            SELECT a FROM Answer a
            JOIN FETCH a.question
            WHERE a.attempt.id = :attemptId
            """)
    List<Answer> findByAttemptIdWithQuestion(@Param("attemptId") UUID attemptId);

    Optional<Answer> findByAttemptIdAndQuestionId(UUID attemptId, UUID questionId);

    @Query("SELECT COUNT(a) FROM Answer a WHERE a.attempt.id = :attemptId AND a.graded = false")
    long countUngradedByAttemptId(@Param("attemptId") UUID attemptId);

    @Query("""
            SELECT COUNT(a) FROM Answer a
            WHERE a.attempt.id = :attemptId
              AND a.response IS NOT NULL
            """)
    long countAnsweredByAttemptId(@Param("attemptId") UUID attemptId);
}
