package io.budgetmart.ecommerce.domain.coupon;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface CouponRepository {

    Optional<Coupon> findById(String id);

    Optional<Coupon> findByTenantIdAndCodeAndActiveTrue(String tenantId, String code);

    boolean existsByTenantIdAndCode(String tenantId, String code);

    List<Coupon> findByTenantId(String tenantId, Pageable pageable);

    List<Coupon> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable);

    Coupon save(Coupon coupon);

    /**
     * times_redeemed를 저장소에서 원자적으로 1 증가시킨다.
     *
     * @return 반영된 문서 수
     */
    long incrementTimesRedeemed(String id);

    default Coupon findActiveByCodeOrThrow(String tenantId, String code) {
        return findByTenantIdAndCodeAndActiveTrue(tenantId, code)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.INVALID_COUPON,
                "유효하지 않은 쿠폰입니다. code: " + code
            ));
    }
}
