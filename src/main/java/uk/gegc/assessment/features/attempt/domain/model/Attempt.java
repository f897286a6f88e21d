package uk.gegc.assessment.features.attempt.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.question.domain.model.Answer;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "attempts")
public class Attempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "assessment_id", nullable = false)
    private Assessment assessment;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AttemptStatus status;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    /** Deadline. Moves only through an explicit time extension. */
    @Column(name = "ends_at", nullable = false)
    private Instant endsAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "time_spent_seconds", nullable = false)
    private long timeSpentSeconds;

    @Column(name = "time_remaining_seconds", nullable = false)
    private long timeRemainingSeconds;

    @Column(name = "score")
    private Double score;

    @Column(name = "max_score")
    private Double maxScore;

    @Column(name = "percentage")
    private Double percentage;

    @Column(name = "passed")
    private Boolean passed;

    @Column(name = "is_graded", nullable = false)
    private boolean graded;

    @Column(name = "graded_at")
    private Instant gradedAt;

    @Column(name = "current_question_index", nullable = false)
    private int currentQuestionIndex;

    @Column(name = "questions_answered", nullable = false)
    private int questionsAnswered;

    @Column(name = "total_questions", nullable = false)
    private int totalQuestions;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 20)
    private AttemptEndReason endReason;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "session_data", columnDefinition = "jsonb")
    private String sessionData;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @OneToMany(mappedBy = "attempt", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Answer> answers = new ArrayList<>();

    public boolean isInProgress() {
        return status == AttemptStatus.IN_PROGRESS;
    }

    public boolean isExpired(Instant now) {
        return endsAt != null && now.isAfter(endsAt);
    }

    /**
     * Moves the attempt into a terminal state and records how long it ran. Time spent stops
     * counting at the deadline, even when the transition is observed later.
     */
    public void finish(AttemptStatus next, AttemptEndReason reason, Instant now) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new InvalidAttemptStateException(id, status, "move to " + next);
        }
        Instant effectiveEnd = endsAt != null && now.isAfter(endsAt) ? endsAt : now;
        this.status = next;
        this.endReason = reason;
        this.completedAt = now;
        this.timeSpentSeconds = Math.max(0, Duration.between(startedAt, effectiveEnd).getSeconds());
        this.timeRemainingSeconds = secondsRemaining(now);
    }

    public long secondsRemaining(Instant now) {
        if (endsAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(now, endsAt).getSeconds());
    }
}
