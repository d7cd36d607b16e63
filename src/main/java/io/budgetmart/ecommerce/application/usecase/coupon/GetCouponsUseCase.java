package io.budgetmart.ecommerce.application.usecase.coupon;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.coupon.dto.CouponResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetCouponsUseCase {

    private final CouponRepository couponRepository;

    /**
     * @param active null이면 활성 여부와 무관하게 전체
     */
    public List<CouponResponse> execute(String tenantId, Boolean active, int limit) {
        Pageable pageable = ListLimit.of(limit);
        List<Coupon> coupons = active == null
            ? couponRepository.findByTenantId(tenantId, pageable)
            : couponRepository.findByTenantIdAndActive(tenantId, active, pageable);

        log.debug("Found {} coupons for tenantId: {}", coupons.size(), tenantId);
        return coupons.stream()
            .map(CouponResponse::from)
            .toList();
    }
}
