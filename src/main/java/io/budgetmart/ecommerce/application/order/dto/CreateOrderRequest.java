package io.budgetmart.ecommerce.application.order.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateOrderRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotEmpty(message = "주문 상품은 최소 1개 이상이어야 합니다")
    List<OrderItemRequest> items,

    String customerId,

    String customerName,

    @Email(message = "올바른 이메일 형식이 아닙니다")
    String customerEmail,

    String couponCode
) {
}
