package uk.gegc.assessment.features.attempt.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AttemptRepository extends JpaRepository<Attempt, UUID> {

    @Query("""
            SELECT a FROM Attempt a
            JOIN FETCH a.assessment
            JOIN FETCH a.user
            WHERE a.id = :id
            """)
    Optional<Attempt> findByIdWithAssessmentAndUser(@Param("id") UUID id);

    @Query("""
            SELECT a FROM Attempt a
            JOIN FETCH a.assessment
            WHERE a.user.id = :userId
              AND a.assessment.id = :assessmentId
              AND a.status = :status
            """)
    Optional<Attempt> findByUserIdAndAssessmentIdAndStatus(@Param("userId") UUID userId,
                                                           @Param("assessmentId") UUID assessmentId,
                                                           @Param("status") AttemptStatus status);

    long countByUserIdAndAssessmentId(UUID userId, UUID assessmentId);

    @Query("""
            SELECT a FROM Attempt a
            WHERE a.user.id = :userId
              AND a.assessment.id = :assessmentId
            ORDER BY a.attemptNumber ASC
            """)
    List<Attempt> findByUserIdAndAssessmentId(@Param("userId") UUID userId,
                                              @Param("assessmentId") UUID assessmentId);

    @Query("""
            SELECT a FROM Attempt a
            WHERE a.assessment.id = :assessmentId
            ORDER BY a.startedAt ASC
            """)
    List<Attempt> findByAssessmentId(@Param("assessmentId") UUID assessmentId);

    @Query("SELECT a.id FROM Attempt a WHERE a.assessment.id = :assessmentId AND a.status IN :statuses")
    List<UUID> findIdsByAssessmentIdAndStatusIn(@Param("assessmentId") UUID assessmentId,
                                                @Param("statuses") Collection<AttemptStatus> statuses);

    @Query("""
            SELECT DISTINCT ans.attempt.id FROM Answer ans
            WHERE ans.question.id = :questionId
              AND ans.attempt.status IN :statuses
            """)
    List<UUID> findIdsByQuestionIdAndStatusIn(@Param("questionId") UUID questionId,
                                              @Param("statuses") Collection<AttemptStatus> statuses);

    @Query("SELECT a.id FROM Attempt a WHERE a.status = :status AND a.endsAt < :now ORDER BY a.endsAt ASC")
    List<UUID> findExpiredIds(@Param("status") AttemptStatus status,
                              @Param("now") Instant now,
                              Pageable pageable);
}
