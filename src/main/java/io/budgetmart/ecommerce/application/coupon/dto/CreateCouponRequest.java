package io.budgetmart.ecommerce.application.coupon.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CreateCouponRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "쿠폰 코드는 필수입니다")
    String code,

    @DecimalMin(value = "0", message = "할인율은 0 이상이어야 합니다")
    @DecimalMax(value = "100", message = "할인율은 100 이하여야 합니다")
    BigDecimal percentOff,

    @DecimalMin(value = "0", message = "할인 금액은 0 이상이어야 합니다")
    BigDecimal amountOff,

    Boolean active,

    @PositiveOrZero(message = "최대 사용 횟수는 0 이상이어야 합니다")
    Integer maxRedemptions
) {
}
