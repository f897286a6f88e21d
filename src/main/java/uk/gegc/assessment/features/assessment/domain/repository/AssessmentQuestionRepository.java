package uk.gegc.assessment.features.assessment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.assessment.features.assessment.domain.model.AssessmentQuestion;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AssessmentQuestionRepository extends JpaRepository<AssessmentQuestion, UUID> {

    @Query("""
            SELECT aq FROM AssessmentQuestion aq
            JOIN FETCH aq.question
            WHERE aq.assessment.id = :assessmentId
            ORDER BY aq.questionOrder ASC
            """)
    List<AssessmentQuestion> findByAssessmentIdWithQuestions(@Param("assessmentId") UUID assessmentId);

    @Query("SELECT COALESCE(SUM(aq.points), 0) FROM AssessmentQuestion aq WHERE aq.assessment.id = :assessmentId")
    long sumPointsByAssessmentId(@Param("assessmentId") UUID assessmentId);

    long countByAssessmentId(UUID assessmentId);

    @Query("""
            SELECT aq FROM AssessmentQuestion aq
            JOIN FETCH aq.assessment
            WHERE aq.question.id = :questionId
            """)
    List<AssessmentQuestion> findByQuestionIdWithAssessment(@Param("questionId") UUID questionId);

    Optional<AssessmentQuestion> findByAssessmentIdAndQuestionId(UUID assessmentId, UUID questionId);
}
