package uk.gegc.assessment.features.randomization.infra.listener;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.assessment.features.attempt.domain.event.AttemptClosedEvent;
import uk.gegc.assessment.features.randomization.application.RandomizationService;

@Component
@RequiredArgsConstructor
public class SeedCleanupListener {

    private final RandomizationService randomizationService;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttemptClosed(AttemptClosedEvent event) {
        randomizationService.clearSeeds(event.getAttemptId());
    }
}
