package uk.gegc.assessment.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.assessment.features.question.domain.model.Question;

import java.util.UUID;

public interface QuestionRepository extends JpaRepository<Question, UUID> {
}
