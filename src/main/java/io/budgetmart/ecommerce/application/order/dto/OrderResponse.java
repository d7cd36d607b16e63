package io.budgetmart.ecommerce.application.order.dto;

import io.budgetmart.ecommerce.domain.order.Order;
import io.budgetmart.ecommerce.domain.order.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
    String id,
    String tenantId,
    String customerId,
    String customerName,
    String customerEmail,
    List<OrderItemResponse> items,
    BigDecimal subtotal,
    BigDecimal discount,
    BigDecimal total,
    String couponCode,
    OrderStatus status,
    LocalDateTime createdAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
            order.getId(),
            order.getTenantId(),
            order.getCustomerId(),
            order.getCustomerName(),
            order.getCustomerEmail(),
            order.getItems().stream().map(OrderItemResponse::from).toList(),
            order.getSubtotal(),
            order.getDiscount(),
            order.getTotal(),
            order.getCouponCode(),
            order.getStatus(),
            order.getCreatedAt()
        );
    }
}
