package io.budgetmart.ecommerce.application.order.dto;

/**
 * 주문 항목 요청
 *
 * quantity가 없으면 1개로 처리한다. 값 검증은 CreateOrderUseCase에서 항목 순서대로 수행한다.
 */
public record OrderItemRequest(
    String productId,
    Integer quantity
) {
    public static final int DEFAULT_QUANTITY = 1;

    public int quantityOrDefault() {
        return quantity == null ? DEFAULT_QUANTITY : quantity;
    }
}
