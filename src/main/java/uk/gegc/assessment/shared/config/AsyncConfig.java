package uk.gegc.assessment.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for background work.
 *
 * <p>Grading gets its own pool so that a burst of submissions at an exam deadline
 * cannot starve the general pool used by event listeners.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.grading.core-pool-size:2}")
    private int gradingCorePoolSize;

    @Value("${async.grading.max-pool-size:4}")
    private int gradingMaxPoolSize;

    @Value("${async.grading.queue-capacity:100}")
    private int gradingQueueCapacity;

    @Value("${async.grading.keep-alive-seconds:60}")
    private int gradingKeepAliveSeconds;

    @Value("${async.general.core-pool-size:2}")
    private int generalCorePoolSize;

    @Value("${async.general.max-pool-size:4}")
    private int generalMaxPoolSize;

    @Value("${async.general.queue-capacity:25}")
    private int generalQueueCapacity;

    @Value("${async.general.keep-alive-seconds:60}")
    private int generalKeepAliveSeconds;

    @Bean(name = "gradingTaskExecutor")
    public ThreadPoolTaskExecutor gradingTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(gradingCorePoolSize);
        executor.setMaxPoolSize(gradingMaxPoolSize);
        executor.setQueueCapacity(gradingQueueCapacity);
        executor.setKeepAliveSeconds(gradingKeepAliveSeconds);
        executor.setThreadNamePrefix("grading-");
        // A full queue pushes grading back onto the submitting thread rather than dropping it.
        // The grading entry points open their own transaction, so an inline run still commits.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Grading Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                gradingCorePoolSize, gradingMaxPoolSize, gradingQueueCapacity, gradingKeepAliveSeconds);

        return executor;
    }

    @Bean(name = "generalTaskExecutor")
    public Executor generalTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(generalCorePoolSize);
        executor.setMaxPoolSize(generalMaxPoolSize);
        executor.setQueueCapacity(generalQueueCapacity);
        executor.setKeepAliveSeconds(generalKeepAliveSeconds);
        executor.setThreadNamePrefix("general-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("General Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                generalCorePoolSize, generalMaxPoolSize, generalQueueCapacity, generalKeepAliveSeconds);

        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return generalTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
