package io.budgetmart.ecommerce.domain.order;

import java.math.BigDecimal;

/**
 * 주문 생성 완료 이벤트
 *
 * 발행 시점: 주문 저장, 재고 확보, 쿠폰 사용 처리가 모두 끝난 직후
 * 처리: 테넌트 웹훅으로 order.created 전달 (비동기, best-effort)
 */
public record OrderCreatedEvent(
    String tenantId,
    String orderId,
    BigDecimal total,
    String couponCode
) {
    public static final String EVENT_NAME = "order.created";
}
