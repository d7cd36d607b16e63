package io.budgetmart.ecommerce.application.product.dto;

import jakarta.validation.constraints.NotNull;

/**
 * 재고 조정 요청
 *
 * @param delta 양수면 입고, 음수면 차감
 */
public record AdjustStockRequest(
    @NotNull(message = "조정 수량은 필수입니다")
    Integer delta
) {
}
