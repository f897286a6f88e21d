package uk.gegc.assessment.features.assessment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "assessments")
public class Assessment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "title", nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AssessmentStatus status;

    /** Time allowed per attempt, 5 to 300 minutes. */
    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    /** Minimum percentage required to pass. */
    @Column(name = "passing_score", nullable = false)
    private Integer passingScore;

    @Column(name = "max_attempts", nullable = false)
    private Integer maxAttempts = 1;

    @Column(name = "due_date")
    private Instant dueDate;

    @Column(name = "randomize_questions", nullable = false)
    private boolean randomizeQuestions;

    @Column(name = "randomize_options", nullable = false)
    private boolean randomizeOptions;

    @Column(name = "show_correct_answers", nullable = false)
    private boolean showCorrectAnswers;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "assessment", fetch = FetchType.LAZY)
    @OrderBy("questionOrder ASC")
    private List<AssessmentQuestion> questions = new ArrayList<>();

    public boolean isActive() {
        return status == AssessmentStatus.ACTIVE;
    }

    public boolean isPastDue(Instant now) {
        return dueDate != null && now.isAfter(dueDate);
    }
}
