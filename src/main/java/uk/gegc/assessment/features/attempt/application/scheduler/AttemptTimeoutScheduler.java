package uk.gegc.assessment.features.attempt.application.scheduler;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.attempt.application.AttemptService;
import uk.gegc.assessment.features.attempt.domain.model.AttemptStatus;
import uk.gegc.assessment.features.attempt.domain.repository.AttemptRepository;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Times out attempts whose deadline passed without the student coming back. Each attempt is
 * handled in its own transaction so one failure does not hold up the rest of the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AttemptTimeoutScheduler {

    private final AttemptRepository attemptRepository;
    private final AttemptService attemptService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${attempt.timeout-sweep.batch-size:200}")
    private int batchSize = 200;

    /**
     * The delay is configurable via attempt.timeout-sweep.interval-seconds. Default: 60 seconds
     */
    @Scheduled(fixedDelayString = "${attempt.timeout-sweep.interval-seconds:60}000")
    public void sweepExpiredAttempts() {
        List<UUID> expired = attemptRepository.findExpiredIds(
                AttemptStatus.IN_PROGRESS, clock.instant(), PageRequest.of(0, batchSize));
        if (expired.isEmpty()) {
            return;
        }
        log.debug("Timing out {} expired attempts", expired.size());

        int timedOut = 0;
        for (UUID attemptId : expired) {
            try {
                if (attemptService.handleTimeout(attemptId)) {
                    timedOut++;
                    meterRegistry.counter("attempt.timeouts.swept").increment();
                }
            } catch (Exception e) {
                // Picked up again on the next run if still in progress
                log.error("Failed to time out attempt {}", attemptId, e);
            }
        }
        log.info("Timeout sweep finished: {} of {} expired attempts timed out", timedOut, expired.size());
    }
}
