package io.budgetmart.ecommerce.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * 웹훅 전달 설정 (budgetmart.webhook.*)
 */
@ConfigurationProperties(prefix = "budgetmart.webhook")
public record WebhookProperties(
        @DefaultValue("2s") Duration timeout,
        @DefaultValue("2") int corePoolSize,
        @DefaultValue("8") int maxPoolSize,
        @DefaultValue("200") int queueCapacity
) {
}
