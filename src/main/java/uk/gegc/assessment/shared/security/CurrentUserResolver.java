package uk.gegc.assessment.shared.security;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.features.user.domain.repository.UserRepository;
import uk.gegc.assessment.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Resolves the caller from the {@value #USER_HEADER} header. Authentication happens upstream.
 */
@Component
@RequiredArgsConstructor
public class CurrentUserResolver {

    public static final String USER_HEADER = "X-User-Id";

    private final UserRepository userRepository;

    public User resolve(UUID userId) {
        if (userId == null) {
            throw new UnauthorizedException("Missing " + USER_HEADER + " header");
        }
        return userRepository.findById(userId)
                .orElseThrow(() -> new UnauthorizedException("Unknown user " + userId));
    }
}
