package uk.gegc.assessment.features.question.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import uk.gegc.assessment.features.attempt.domain.model.Attempt;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "answers")
public class Answer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "attempt_id", nullable = false)
    private Attempt attempt;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    /** Type-tagged payload; null until the student responds. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "response", columnDefinition = "jsonb")
    private String response;

    @Column(name = "score", nullable = false)
    private Double score = 0.0;

    @Column(name = "max_score", nullable = false)
    private Double maxScore = 0.0;

    /** Null until graded. */
    @Column(name = "is_correct")
    private Boolean isCorrect;

    @Column(name = "is_graded", nullable = false)
    private boolean graded;

    /** Set only for manual grades. */
    @Column(name = "graded_by")
    private UUID gradedBy;

    @Column(name = "graded_at")
    private Instant gradedAt;

    @Column(name = "feedback")
    private String feedback;

    @Column(name = "time_spent_seconds", nullable = false)
    private long timeSpentSeconds;

    @Column(name = "first_answered_at")
    private Instant firstAnsweredAt;

    @Column(name = "last_modified_at")
    private Instant lastModifiedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "history", columnDefinition = "jsonb")
    private String history;

    @Column(name = "flagged", nullable = false)
    private boolean flagged;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isManuallyGraded() {
        return graded && gradedBy != null;
    }
}
