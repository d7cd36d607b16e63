package io.budgetmart.ecommerce.application.webhook.dto;

import java.util.Map;

/**
 * 웹훅 POST 본문: {"event": ..., "data": ...}
 */
public record WebhookPayload(
    String event,
    Map<String, Object> data
) {
    public static WebhookPayload of(String event, Map<String, Object> data) {
        return new WebhookPayload(event, data);
    }
}
