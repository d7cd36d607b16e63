package io.budgetmart.ecommerce.config;

import io.budgetmart.ecommerce.infrastructure.metrics.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncConfigTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("webhookExecutor 포화 시 전달은 버려지고 호출 스레드에서 실행되지 않는다")
    void webhookExecutor_포화시_버림() throws InterruptedException {
        // Given - 스레드 1개, 큐 1칸
        executor = (ThreadPoolTaskExecutor) new AsyncConfig().webhookExecutor(
            new WebhookProperties(Duration.ofSeconds(2), 1, 1, 1),
            new MetricsCollector(meterRegistry));

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            awaitQuietly(release);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(() -> awaitQuietly(release));

        // When - 세 번째 작업은 거절된다
        AtomicBoolean ranOnCaller = new AtomicBoolean(false);
        Thread caller = Thread.currentThread();
        executor.execute(() -> ranOnCaller.set(Thread.currentThread() == caller));
        release.countDown();

        // Then
        assertThat(ranOnCaller).isFalse();
        assertThat(meterRegistry.get("webhook_rejections_total").counter().count()).isEqualTo(1.0);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
