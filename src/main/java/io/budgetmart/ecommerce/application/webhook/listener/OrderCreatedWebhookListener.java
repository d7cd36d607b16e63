package io.budgetmart.ecommerce.application.webhook.listener;

import io.budgetmart.ecommerce.application.webhook.WebhookDispatcher;
import io.budgetmart.ecommerce.domain.order.OrderCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 주문 생성 → 웹훅 전달
 * <p>
 * webhookExecutor 스레드에서 실행되어 주문 응답을 지연시키지 않는다.
 * 전달 실패는 주문 결과에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderCreatedWebhookListener {

    private final WebhookDispatcher webhookDispatcher;

    @Async("webhookExecutor")
    @EventListener
    public void handle(OrderCreatedEvent event) {
        log.debug("Dispatching {} webhooks. orderId: {}", OrderCreatedEvent.EVENT_NAME, event.orderId());

        // coupon은 null일 수 있어 Map.of 대신 LinkedHashMap
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", event.orderId());
        data.put("total", event.total());
        data.put("coupon", event.couponCode());

        webhookDispatcher.dispatch(event.tenantId(), OrderCreatedEvent.EVENT_NAME, data);
    }
}
