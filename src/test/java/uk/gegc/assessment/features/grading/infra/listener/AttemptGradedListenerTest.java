package uk.gegc.assessment.features.grading.infra.listener;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import uk.gegc.assessment.features.grading.domain.event.AttemptGradedEvent;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class AttemptGradedListenerTest {

    @Test
    void countsOutcomes() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AttemptGradedListener listener = new AttemptGradedListener(registry);

        listener.onAttemptGraded(event(80.0, true, true));
        listener.onAttemptGraded(event(40.0, false, false));
        listener.onAttemptGraded(event(90.0, true, true));

        assertThat(registry.counter("grading.attempts.graded", "outcome", "passed", "complete", "true").count())
                .isEqualTo(2.0);
        assertThat(registry.counter("grading.attempts.graded", "outcome", "failed", "complete", "false").count())
                .isEqualTo(1.0);
    }

    private AttemptGradedEvent event(double percentage, boolean passed, boolean fullyGraded) {
        return new AttemptGradedEvent(this, UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                percentage, passed, fullyGraded);
    }
}
