package uk.gegc.assessment.features.attempt.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
class AttemptTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private Attempt attempt;

    @BeforeEach
    void setUp() {
        attempt = new Attempt();
        attempt.setId(UUID.randomUUID());
        attempt.setStatus(AttemptStatus.IN_PROGRESS);
        attempt.setStartedAt(START);
        attempt.setEndsAt(START.plusSeconds(3600));
    }

    @Test
    @DisplayName("finish before the deadline records elapsed and remaining time")
    void finishBeforeDeadline() {
        attempt.finish(AttemptStatus.COMPLETED, AttemptEndReason.SUBMITTED, START.plusSeconds(600));

        assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.COMPLETED);
        assertThat(attempt.getEndReason()).isEqualTo(AttemptEndReason.SUBMITTED);
        assertThat(attempt.getCompletedAt()).isEqualTo(START.plusSeconds(600));
        assertThat(attempt.getTimeSpentSeconds()).isEqualTo(600);
        assertThat(attempt.getTimeRemainingSeconds()).isEqualTo(3000);
    }

    @Test
    @DisplayName("finish after the deadline caps time spent at the duration")
    void finishAfterDeadlineIsCapped() {
        attempt.finish(AttemptStatus.TIMEOUT, AttemptEndReason.TIME_OUT, START.plusSeconds(5000));

        assertThat(attempt.getTimeSpentSeconds()).isEqualTo(3600);
        assertThat(attempt.getTimeRemainingSeconds()).isZero();
    }

    @Test
    @DisplayName("terminal attempts cannot move again")
    void terminalIsFinal() {
        attempt.finish(AttemptStatus.ABANDONED, AttemptEndReason.ABANDONED, START.plusSeconds(60));

        assertThatThrownBy(() -> attempt.finish(AttemptStatus.COMPLETED, AttemptEndReason.SUBMITTED, START.plusSeconds(120)))
                .isInstanceOf(InvalidAttemptStateException.class);
        assertThat(attempt.getStatus()).isEqualTo(AttemptStatus.ABANDONED);
    }

    @Test
    @DisplayName("expiry is strictly after the deadline")
    void expiry() {
        assertThat(attempt.isExpired(START.plusSeconds(3600))).isFalse();
        assertThat(attempt.isExpired(START.plusSeconds(3601))).isTrue();
    }

    @Test
    @DisplayName("status transitions only leave IN_PROGRESS")
    void transitions() {
        assertThat(AttemptStatus.IN_PROGRESS.canTransitionTo(AttemptStatus.TIMEOUT)).isTrue();
        assertThat(AttemptStatus.IN_PROGRESS.canTransitionTo(AttemptStatus.IN_PROGRESS)).isFalse();
        assertThat(AttemptStatus.COMPLETED.canTransitionTo(AttemptStatus.ABANDONED)).isFalse();
        assertThat(AttemptStatus.TIMEOUT.isGradeable()).isTrue();
        assertThat(AttemptStatus.ABANDONED.isGradeable()).isFalse();
    }
}
