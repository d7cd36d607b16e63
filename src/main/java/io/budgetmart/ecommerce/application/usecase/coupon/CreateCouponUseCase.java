package io.budgetmart.ecommerce.application.usecase.coupon;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.coupon.dto.CreateCouponRequest;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

/**
 * 쿠폰 생성
 * <p>
 * 같은 테넌트 안에서 code 중복 불가. 다른 테넌트는 같은 code를 쓸 수 있다.
 * 사전 조회를 통과한 동시 요청은 (tenant_id, code) 유니크 인덱스가 막는다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateCouponUseCase {

    private final TenantRepository tenantRepository;
    private final CouponRepository couponRepository;

    public IdResponse execute(CreateCouponRequest request) {
        tenantRepository.verifyExists(request.tenantId());

        if (couponRepository.existsByTenantIdAndCode(request.tenantId(), request.code())) {
            throw duplicate(request);
        }

        Coupon coupon = Coupon.create(
            request.tenantId(),
            request.code(),
            request.percentOff(),
            request.amountOff(),
            request.active(),
            request.maxRedemptions()
        );

        try {
            Coupon saved = couponRepository.save(coupon);
            log.info("Coupon created. tenantId: {}, couponId: {}, code: {}",
                saved.getTenantId(), saved.getId(), saved.getCode());
            return IdResponse.of(saved.getId());
        } catch (DuplicateKeyException e) {
            throw duplicate(request);
        }
    }

    private BusinessException duplicate(CreateCouponRequest request) {
        log.warn("Duplicate coupon code. tenantId: {}, code: {}", request.tenantId(), request.code());
        return new BusinessException(ErrorCode.DUPLICATE_COUPON, "이미 존재하는 쿠폰 코드입니다. code: " + request.code());
    }
}
