package io.budgetmart.ecommerce.application.order.dto;

import io.budgetmart.ecommerce.domain.order.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
    String productId,
    int quantity,
    BigDecimal price,
    String title
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
            item.getProductId(),
            item.getQuantity(),
            item.getPrice(),
            item.getTitle()
        );
    }
}
