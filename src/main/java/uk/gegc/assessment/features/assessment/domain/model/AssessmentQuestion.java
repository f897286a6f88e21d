package uk.gegc.assessment.features.assessment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.assessment.features.question.domain.model.Question;

import java.util.UUID;

/**
 * Binds a question to an assessment. {@code points} is what the question is worth in this
 * assessment and overrides the question's own default when grading.
 */
@Entity
@Getter
@Setter
@Table(name = "assessment_questions")
public class AssessmentQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "assessment_id", nullable = false)
    private Assessment assessment;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    private Question question;

    @Column(name = "question_order", nullable = false)
    private Integer questionOrder;

    @Column(name = "points", nullable = false)
    private Integer points;
}
