package com.phillippitts.speakerverify.config;

import com.phillippitts.speakerverify.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void verifyExecutorUsesConfiguredSizes() {
        Executor executor = config.verifyExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(8);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("verify-pool-");
        taskExecutor.shutdown();
    }

    @Test
    void runsManyTasksToCompletion() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.verifyExecutor();
        int taskCount = 20;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completed.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
        executor.shutdown();
    }

    @Test
    void propagatesRequestContextToWorkerThread() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.verifyExecutor();
        ThreadContext.put("requestId", "req-42");
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(thread.get()).startsWith("verify-pool-");
        executor.shutdown();
    }

    @Test
    void decoratorRestoresWorkerContextAfterTask() {
        ThreadContext.put("requestId", "submitter");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() ->
                assertThat(ThreadContext.get("requestId")).isEqualTo("submitter"));

        ThreadContext.clearMap();
        ThreadContext.put("requestId", "worker-own");
        decorated.run();

        assertThat(ThreadContext.get("requestId")).isEqualTo("worker-own");
    }

    @Test
    void modelLoadExecutorDropsExtraTriggers() {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) config.modelLoadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger ran = new AtomicInteger();
        Runnable task = () -> {
            ran.incrementAndGet();
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        // one running, one queued, the rest dropped
        for (int i = 0; i < 5; i++) {
            executor.execute(task);
        }
        release.countDown();

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> executor.getThreadPoolExecutor().getCompletedTaskCount() == 2);
        assertThat(ran.get()).isEqualTo(2);
        executor.shutdown();
    }
}
