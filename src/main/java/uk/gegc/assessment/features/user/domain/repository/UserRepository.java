package uk.gegc.assessment.features.user.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.assessment.features.user.domain.model.User;

import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {
}
