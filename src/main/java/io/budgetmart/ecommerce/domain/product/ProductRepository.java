package io.budgetmart.ecommerce.domain.product;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findByIdAndTenantId(String id, String tenantId);

    List<Product> findByTenantId(String tenantId, Pageable pageable);

    /**
     * 상품명 부분 일치 검색 (대소문자 무시, 입력 문자열은 정규식이 아닌 리터럴로 취급)
     */
    List<Product> findByTenantIdAndTitleContainingIgnoreCase(String tenantId, String title, Pageable pageable);

    Product save(Product product);

    /**
     * 조건부 재고 증감: 현재 재고가 [minimumStock, maximumStock] 범위일 때만 delta를 반영한다.
     * maximumStock은 증가 후 재고가 int 범위를 넘지 않도록 잡는 상한이다.
     *
     * @return 반영된 문서 수 (0 또는 1)
     */
    long incrementStockIfWithin(String id, int minimumStock, int maximumStock, int delta);

    /**
     * 재고 차감 (Compare-And-Set)
     * 동시 주문이 같은 상품을 경쟁해도 재고가 음수가 되지 않는다.
     */
    default boolean decreaseStockIfAvailable(String id, int quantity) {
        return incrementStockIfWithin(id, quantity, Integer.MAX_VALUE, -quantity) > 0;
    }

    /**
     * 재고 증가. 결과가 Integer.MAX_VALUE를 넘으면 반영하지 않고 false.
     */
    default boolean increaseStockIfWithinLimit(String id, int quantity) {
        return incrementStockIfWithin(id, 0, Integer.MAX_VALUE - quantity, quantity) > 0;
    }

    /**
     * 보상 처리용 재고 복구
     */
    default void restoreStock(String id, int quantity) {
        increaseStockIfWithinLimit(id, quantity);
    }

    default Product findByIdAndTenantIdOrThrow(String id, String tenantId) {
        return findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "상품을 찾을 수 없습니다. productId: " + id
            ));
    }
}
