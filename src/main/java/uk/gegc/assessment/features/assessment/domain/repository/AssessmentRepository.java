package uk.gegc.assessment.features.assessment.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;

import java.util.UUID;

public interface AssessmentRepository extends JpaRepository<Assessment, UUID> {
}
