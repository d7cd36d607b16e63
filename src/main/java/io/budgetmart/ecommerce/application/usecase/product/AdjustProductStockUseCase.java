package io.budgetmart.ecommerce.application.usecase.product;

import io.budgetmart.ecommerce.application.product.dto.ProductResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.DocumentIds;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 관리자 재고 조정
 * <p>
 * 증감은 저장소의 조건부 $inc 한 번으로 반영한다.
 * 차감량이 현재 재고보다 크면 아무것도 바꾸지 않고 INSUFFICIENT_STOCK.
 * 증가 결과가 int 범위를 넘으면 아무것도 바꾸지 않고 INVALID_INPUT.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class AdjustProductStockUseCase {

    private final ProductRepository productRepository;

    public ProductResponse execute(String tenantId, String productId, int delta) {
        DocumentIds.validate(productId);
        Product product = productRepository.findByIdAndTenantIdOrThrow(productId, tenantId);

        if (delta < 0) {
            // Integer.MIN_VALUE는 부호를 바꿀 수 없고 어떤 재고로도 충족되지 않는다
            if (delta == Integer.MIN_VALUE || !productRepository.decreaseStockIfAvailable(productId, -delta)) {
                throw new BusinessException(
                    ErrorCode.INSUFFICIENT_STOCK,
                    String.format("재고가 부족합니다. 상품: %s, 요청: %d", product.getTitle(), -(long) delta)
                );
            }
        } else if (delta > 0) {
            if (!productRepository.increaseStockIfWithinLimit(productId, delta)) {
                log.warn("Stock adjustment would overflow. productId: {}, delta: {}", productId, delta);
                throw new BusinessException(
                    ErrorCode.INVALID_INPUT,
                    String.format("재고 최대치를 초과합니다. 상품: %s, 요청: %d", product.getTitle(), delta)
                );
            }
        }

        Product adjusted = productRepository.findByIdAndTenantIdOrThrow(productId, tenantId);
        log.info("Product stock adjusted. productId: {}, delta: {}, stock: {}", productId, delta, adjusted.getStock());
        return ProductResponse.from(adjusted);
    }
}
