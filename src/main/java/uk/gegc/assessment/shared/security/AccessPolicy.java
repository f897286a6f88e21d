package uk.gegc.assessment.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.assessment.domain.model.Assessment;
import uk.gegc.assessment.features.user.domain.model.RoleName;
import uk.gegc.assessment.features.user.domain.model.User;
import uk.gegc.assessment.shared.exception.ForbiddenException;

import java.util.UUID;

/**
 * Applies the simple role and ownership rules for attempts and grading in one place.
 * Admins may act on any assessment; teachers only on assessments they created.
 */
@Component
@Slf4j
public class AccessPolicy {

    private static final String DEFAULT_FORBIDDEN_MESSAGE = "Access denied";

    public boolean isOwner(User user, UUID ownerId) {
        return user != null && ownerId != null && ownerId.equals(user.getId());
    }

    public void requireOwner(User user, UUID ownerId) {
        if (!isOwner(user, ownerId)) {
            throwForbidden("You do not have access to this attempt");
        }
    }

    public boolean isGrader(User user) {
        return user != null && user.getRole() != null && user.getRole().canGrade();
    }

    public boolean hasAssessmentAccess(User user, Assessment assessment) {
        if (!isGrader(user) || assessment == null) {
            return false;
        }
        if (user.getRole() == RoleName.ADMIN) {
            return true;
        }
        return assessment.getCreatedBy() != null && assessment.getCreatedBy().equals(user.getId());
    }

    public void requireGrader(User user, Assessment assessment) {
        if (!isGrader(user)) {
            throwForbidden("Only teachers and admins may grade");
        }
        if (!hasAssessmentAccess(user, assessment)) {
            throwForbidden("No access to assessment " + (assessment != null ? assessment.getId() : null));
        }
    }

    public void requireOwnerOrGrader(User user, UUID ownerId, Assessment assessment) {
        if (isOwner(user, ownerId)) {
            return;
        }
        if (hasAssessmentAccess(user, assessment)) {
            return;
        }
        throwForbidden("Owner or grader access required");
    }

    private void throwForbidden(String message) {
        String msg = message != null ? message : DEFAULT_FORBIDDEN_MESSAGE;
        log.debug("AccessPolicy denying access: {}", msg);
        throw new ForbiddenException(msg);
    }
}
