package io.budgetmart.ecommerce.domain.coupon;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;

/**
 * Coupon Document
 *
 * code는 테넌트 안에서 유일하다 (tenant_id + code 유니크 인덱스).
 * percent_off와 amount_off는 함께 설정될 수 있으며 할인액은 합산된다.
 */
@Document(collection = "coupon")
@CompoundIndex(name = "uk_coupon_tenant_code", def = "{'tenant_id': 1, 'code': 1}", unique = true)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Coupon extends BaseTimeDocument {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    private String id;

    private String tenantId;

    private String code;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal percentOff;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal amountOff;

    private boolean active;

    // 저장만 하고 주문 시 검사하지 않는다. 정책 결정 전까지 무제한 사용 가능.
    private Integer maxRedemptions;

    private int timesRedeemed;

    public static Coupon create(String tenantId, String code, BigDecimal percentOff, BigDecimal amountOff,
                                Boolean active, Integer maxRedemptions) {
        validateCode(code);
        validatePercentOff(percentOff);
        validateAmountOff(amountOff);
        validateMaxRedemptions(maxRedemptions);

        Coupon coupon = new Coupon();
        coupon.tenantId = tenantId;
        coupon.code = code;
        coupon.percentOff = percentOff;
        coupon.amountOff = amountOff;
        coupon.active = active == null || active;
        coupon.maxRedemptions = maxRedemptions;
        coupon.timesRedeemed = 0;
        return coupon;
    }

    /**
     * 할인액 = subtotal × percent_off / 100 + amount_off (반올림 전 값)
     */
    public BigDecimal calculateDiscount(BigDecimal subtotal) {
        BigDecimal discount = BigDecimal.ZERO;
        if (percentOff != null) {
            discount = discount.add(subtotal.multiply(percentOff).divide(HUNDRED));
        }
        if (amountOff != null) {
            discount = discount.add(amountOff);
        }
        return discount;
    }

    public void redeem() {
        this.timesRedeemed++;
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "쿠폰 코드는 필수입니다");
        }
    }

    private static void validatePercentOff(BigDecimal percentOff) {
        if (percentOff != null && (percentOff.signum() < 0 || percentOff.compareTo(HUNDRED) > 0)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "할인율은 0~100 사이여야 합니다");
        }
    }

    private static void validateAmountOff(BigDecimal amountOff) {
        if (amountOff != null && amountOff.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "할인 금액은 0 이상이어야 합니다");
        }
    }

    private static void validateMaxRedemptions(Integer maxRedemptions) {
        if (maxRedemptions != null && maxRedemptions < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "최대 사용 횟수는 0 이상이어야 합니다");
        }
    }
}
