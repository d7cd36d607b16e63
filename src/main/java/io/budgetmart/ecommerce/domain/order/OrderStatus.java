package io.budgetmart.ecommerce.domain.order;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 주문 상태 (API에는 소문자로 노출)
 */
public enum OrderStatus {
    /**
     * 대기중 (주문 생성됨)
     */
    PENDING,

    PAID,

    SHIPPED,

    /**
     * 취소 (재고 확보 실패 시 보상 처리 포함)
     */
    CANCELLED,

    REFUNDED;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
