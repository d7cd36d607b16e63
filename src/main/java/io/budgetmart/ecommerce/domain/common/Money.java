package io.budgetmart.ecommerce.domain.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 금액 계산 규칙: 소수점 둘째 자리, HALF_UP 반올림
 */
public final class Money {

    public static final int SCALE = 2;

    private Money() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
