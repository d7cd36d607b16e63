package io.budgetmart.ecommerce.presentation.api.coupon;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.coupon.dto.CouponResponse;
import io.budgetmart.ecommerce.application.coupon.dto.CreateCouponRequest;
import io.budgetmart.ecommerce.application.usecase.coupon.CreateCouponUseCase;
import io.budgetmart.ecommerce.application.usecase.coupon.GetCouponsUseCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/coupons")
@RequiredArgsConstructor
public class CouponController {

    private final CreateCouponUseCase createCouponUseCase;
    private final GetCouponsUseCase getCouponsUseCase;

    @PostMapping
    public ResponseEntity<IdResponse> createCoupon(@Valid @RequestBody CreateCouponRequest request) {
        return ResponseEntity.ok(createCouponUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<CouponResponse>> getCoupons(
            @RequestParam("tenant_id") String tenantId,
            @RequestParam(required = false) Boolean active,
            @RequestParam(defaultValue = "100") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getCouponsUseCase.execute(tenantId, active, limit));
    }
}
