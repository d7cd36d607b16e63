package io.budgetmart.ecommerce.application.coupon.dto;

import io.budgetmart.ecommerce.domain.coupon.Coupon;

import java.math.BigDecimal;

public record CouponResponse(
    String id,
    String tenantId,
    String code,
    BigDecimal percentOff,
    BigDecimal amountOff,
    boolean active,
    Integer maxRedemptions,
    int timesRedeemed
) {
    public static CouponResponse from(Coupon coupon) {
        return new CouponResponse(
            coupon.getId(),
            coupon.getTenantId(),
            coupon.getCode(),
            coupon.getPercentOff(),
            coupon.getAmountOff(),
            coupon.isActive(),
            coupon.getMaxRedemptions(),
            coupon.getTimesRedeemed()
        );
    }
}
