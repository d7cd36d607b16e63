package io.budgetmart.ecommerce.application.webhook;

import io.budgetmart.ecommerce.application.webhook.dto.WebhookPayload;
import io.budgetmart.ecommerce.domain.webhook.Webhook;
import io.budgetmart.ecommerce.domain.webhook.WebhookRepository;
import io.budgetmart.ecommerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * 테넌트 웹훅 전달 (best-effort)
 * <p>
 * 활성 웹훅 전부에 {"event", "data"}를 POST 한다.
 * 네트워크 오류, 타임아웃, 2xx 외 응답은 WARN 로그만 남기고 넘어간다. 재시도하지 않는다.
 * 구독 이벤트(events)로 거르지 않는다. 활성 웹훅은 모든 이벤트를 받는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookDispatcher {

    private final WebhookRepository webhookRepository;
    private final RestTemplate webhookRestTemplate;
    private final MetricsCollector metricsCollector;

    /**
     * @return 전달에 성공한 웹훅 수
     */
    public int dispatch(String tenantId, String event, Map<String, Object> data) {
        List<Webhook> webhooks = webhookRepository.findByTenantIdAndActiveTrue(tenantId);
        if (webhooks.isEmpty()) {
            log.debug("No active webhooks. tenantId: {}, event: {}", tenantId, event);
            return 0;
        }

        WebhookPayload payload = WebhookPayload.of(event, data);
        int delivered = 0;
        for (Webhook webhook : webhooks) {
            if (deliver(webhook, payload)) {
                delivered++;
            }
        }

        log.info("Webhook dispatch finished. tenantId: {}, event: {}, delivered: {}/{}",
            tenantId, event, delivered, webhooks.size());
        return delivered;
    }

    private boolean deliver(Webhook webhook, WebhookPayload payload) {
        try {
            // 2xx 외 응답은 기본 에러 핸들러가 RestClientException으로 던진다
            webhookRestTemplate.postForEntity(webhook.getUrl(), payload, Void.class);
            metricsCollector.recordWebhookSuccess();
            return true;
        } catch (RestClientException e) {
            metricsCollector.recordWebhookFailure();
            log.warn("Webhook delivery failed. webhookId: {}, url: {}, event: {}, reason: {}",
                webhook.getId(), webhook.getUrl(), payload.event(), e.getMessage());
            return false;
        }
    }
}
