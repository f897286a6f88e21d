package uk.gegc.assessment.features.grading.infra.listener;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.assessment.features.attempt.domain.event.AttemptFinalizedEvent;
import uk.gegc.assessment.features.grading.domain.event.ManualGradeRecordedEvent;
import uk.gegc.assessment.features.grading.infra.dispatch.GradingDispatcher;

/**
 * Hands committed attempt transitions and manual grades to the grading queue. Runs on the
 * committing thread; the dispatcher moves the work onto the grading pool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GradingEventListener {

    private final GradingDispatcher dispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttemptFinalized(AttemptFinalizedEvent event) {
        log.debug("Attempt {} finalized as {} ({}); queueing grading",
                event.getAttemptId(), event.getStatus(), event.getEndReason());
        dispatcher.dispatchAttemptGrading(event.getAttemptId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onManualGradeRecorded(ManualGradeRecordedEvent event) {
        log.debug("Answer {} graded by {}; checking attempt {}",
                event.getAnswerId(), event.getGraderId(), event.getAttemptId());
        dispatcher.dispatchCompletionCheck(event.getAttemptId());
    }
}
