package uk.gegc.assessment.features.grading.infra.listener;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.assessment.features.grading.domain.event.AttemptGradedEvent;

/**
 * Downstream sink for grading results. Records outcomes for dashboards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttemptGradedListener {

    private final MeterRegistry meterRegistry;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttemptGraded(AttemptGradedEvent event) {
        meterRegistry.counter("grading.attempts.graded",
                "outcome", event.isPassed() ? "passed" : "failed",
                "complete", String.valueOf(event.isFullyGraded())).increment();
        log.info("Attempt {} of user {} on assessment {} graded at {}%",
                event.getAttemptId(), event.getUserId(), event.getAssessmentId(), event.getPercentage());
    }
}
