package io.budgetmart.ecommerce.application.webhook.dto;

import io.budgetmart.ecommerce.domain.webhook.Webhook;

import java.util.Set;

public record WebhookResponse(
    String id,
    String tenantId,
    String url,
    Set<String> events,
    boolean active
) {
    public static WebhookResponse from(Webhook webhook) {
        return new WebhookResponse(
            webhook.getId(),
            webhook.getTenantId(),
            webhook.getUrl(),
            webhook.getEvents(),
            webhook.isActive()
        );
    }
}
