package io.budgetmart.ecommerce.config;

import io.budgetmart.ecommerce.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    /**
     * 웹훅 전달 전용 비동기 Executor
     * - 주문 응답 스레드와 분리해 외부 엔드포인트 지연이 응답 시간에 섞이지 않게 한다
     * - 큐가 가득 차면 해당 전달은 버리고 WARN 로그와 webhook_rejections_total을 남긴다
     *   (호출 스레드에서 실행하면 주문 응답이 웹훅 타임아웃만큼 늦어진다)
     */
    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor(WebhookProperties webhookProperties, MetricsCollector metricsCollector) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(webhookProperties.corePoolSize());
        executor.setMaxPoolSize(webhookProperties.maxPoolSize());
        executor.setQueueCapacity(webhookProperties.queueCapacity());
        executor.setThreadNamePrefix("webhook-async-");
        executor.setRejectedExecutionHandler((task, pool) -> {
            metricsCollector.recordWebhookRejection();
            log.warn("Webhook executor saturated, delivery dropped. queue: {}, active: {}, pool: {}",
                pool.getQueue().size(), pool.getActiveCount(), pool.getPoolSize());
        });
        executor.setAwaitTerminationSeconds(30);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
            log.error("Uncaught exception in async task: method={}, params={}",
                method.getName(), Arrays.toString(params), ex);
    }
}
