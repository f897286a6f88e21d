package uk.gegc.assessment.features.grading.infra.dispatch;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import uk.gegc.assessment.features.grading.application.GradingService;
import uk.gegc.assessment.shared.exception.InvalidAttemptStateException;
import uk.gegc.assessment.shared.exception.ResourceNotFoundException;

import java.util.UUID;

/**
 * Background grading queue. Tasks run on the grading pool, are retried with exponential
 * backoff and are counted under {@code grading.dispatch.*}. A task that keeps failing is
 * logged at ERROR and left for a manual regrade.
 */
@Slf4j
@Component
public class GradingDispatcher {

    static final String SUBMITTED = "grading.dispatch.submitted";
    static final String SUCCEEDED = "grading.dispatch.succeeded";
    static final String RETRIED = "grading.dispatch.retried";
    static final String FAILED = "grading.dispatch.failed";

    private final TaskExecutor executor;
    private final GradingService gradingService;
    private final MeterRegistry meterRegistry;
    private final int maxAttempts;
    private final long backoffMs;

    public GradingDispatcher(@Qualifier("gradingTaskExecutor") TaskExecutor executor,
                             GradingService gradingService,
                             MeterRegistry meterRegistry,
                             @Value("${grading.dispatch.max-attempts:3}") int maxAttempts,
                             @Value("${grading.dispatch.backoff-ms:500}") long backoffMs) {
        this.executor = executor;
        this.gradingService = gradingService;
        this.meterRegistry = meterRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    public void dispatchAttemptGrading(UUID attemptId) {
        submit(attemptId, "auto-grade", () -> gradingService.autoGradeAttempt(attemptId));
    }

    public void dispatchCompletionCheck(UUID attemptId) {
        submit(attemptId, "completion check", () -> gradingService.finalizeIfFullyGraded(attemptId));
    }

    private void submit(UUID attemptId, String task, Runnable action) {
        meterRegistry.counter(SUBMITTED, "task", task).increment();
        executor.execute(() -> runWithRetry(attemptId, task, action));
    }

    void runWithRetry(UUID attemptId, String task, Runnable action) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                action.run();
                meterRegistry.counter(SUCCEEDED, "task", task).increment();
                if (attempt > 1) {
                    log.info("Grading {} for attempt {} succeeded on try {}", task, attemptId, attempt);
                }
                return;
            } catch (ResourceNotFoundException | InvalidAttemptStateException e) {
                // Retrying cannot change the outcome
                meterRegistry.counter(FAILED, "task", task).increment();
                log.error("Grading {} for attempt {} rejected: {}", task, attemptId, e.getMessage());
                return;
            } catch (RuntimeException e) {
                if (attempt == maxAttempts) {
                    meterRegistry.counter(FAILED, "task", task).increment();
                    log.error("Grading {} for attempt {} failed after {} tries", task, attemptId, maxAttempts, e);
                    return;
                }
                meterRegistry.counter(RETRIED, "task", task).increment();
                log.warn("Grading {} for attempt {} failed on try {}/{}: {}",
                        task, attemptId, attempt, maxAttempts, e.getMessage());
                if (!sleepBackoff(attempt)) {
                    meterRegistry.counter(FAILED, "task", task).increment();
                    log.error("Grading {} for attempt {} interrupted during backoff", task, attemptId);
                    return;
                }
            }
        }
    }

    private boolean sleepBackoff(int attempt) {
        if (backoffMs == 0) {
            return true;
        }
        try {
            Thread.sleep(backoffMs * (1L << (attempt - 1)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
