package com.phillippitts.speakerverify.config;

import com.phillippitts.speakerverify.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the service's thread pools.
 *
 * <ul>
 *   <li>{@code verifyExecutor}: runs batch verification candidates in parallel; sized via
 *       {@link ThreadPoolProperties} ({@code threadpool.verify.*})</li>
 *   <li>{@code modelLoadExecutor}: single thread for background model loads (start-up warm-up,
 *       recovery triggered by health checks)</li>
 * </ul>
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for batch candidate fan-out.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue are
     * full the request thread runs the candidate itself, which throttles the caller instead of
     * failing the item.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the submitting request thread is copied to the
     * worker so candidate log lines keep the request id.
     *
     * @return configured executor
     */
    @Bean(name = "verifyExecutor")
    public Executor verifyExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getVerify();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Single-thread executor for background model loads. Extra triggers while one is queued are
     * dropped; the coordinator would join the running load anyway.
     *
     * @return configured executor
     */
    @Bean(name = "modelLoadExecutor")
    public Executor modelLoadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("model-load-");
        executor.setRejectedExecutionHandler((task, pool) ->
                LOG.debug("Background model load already scheduled; dropping trigger"));
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker for the task's duration,
     * then restores whatever the worker had before.
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
}
