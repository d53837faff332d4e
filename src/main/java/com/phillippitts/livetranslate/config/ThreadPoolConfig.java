package com.phillippitts.livetranslate.config;

import com.phillippitts.livetranslate.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for streaming sessions.
 *
 * <p>Two pools are kept apart so heavy work never starves message handling:
 * <ul>
 *   <li>{@code processingExecutor}: decode, transcribe and translate jobs from every session.
 *       Bounded; when busy, jobs wait in the queue.</li>
 *   <li>{@code sessionExecutor}: runs each session's serial mailbox (inbound messages and job
 *       completions). Tasks are short and never block on processing.</li>
 * </ul>
 *
 * <p>Rejection policy for both: {@link CallerRunsUnlessShutdownPolicy}, which applies
 * backpressure to the submitter instead of dropping work, and fails loudly once the pool is
 * shut down.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext (notably {@code sessionId}) of the submitting
 * thread is copied to the worker for the duration of the task.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "processingExecutor")
    public Executor processingExecutor() {
        return build(threadPoolProperties.getProcessing());
    }

    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return build(threadPoolProperties.getSession());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdownPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext onto the worker thread and restores the worker's
     * own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    ThreadContext.clearMap();
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }

    /**
     * Runs the rejected task on the submitting thread while the pool is live. After shutdown the
     * task is rejected instead of silently discarded, so callers waiting on it can react.
     */
    static final class CallerRunsUnlessShutdownPolicy implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Executor " + executor + " is shut down");
            }
            r.run();
        }
    }
}
