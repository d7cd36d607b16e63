package io.budgetmart.ecommerce.application.order.dto;

import io.budgetmart.ecommerce.domain.order.Order;

import java.math.BigDecimal;

public record CreateOrderResponse(
    String id,
    BigDecimal total,
    BigDecimal subtotal,
    BigDecimal discount
) {
    public static CreateOrderResponse from(Order order) {
        return new CreateOrderResponse(
            order.getId(),
            order.getTotal(),
            order.getSubtotal(),
            order.getDiscount()
        );
    }
}
