package io.budgetmart.ecommerce.application.usecase.product;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.product.dto.ProductResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetProductsUseCase {

    private final ProductRepository productRepository;

    /**
     * 테넌트 상품 목록
     *
     * @param query 상품명 부분 검색어 (대소문자 무시, 비어 있으면 전체)
     */
    public List<ProductResponse> execute(String tenantId, String query, int limit) {
        log.info("Getting products - tenantId: {}, q: {}, limit: {}", tenantId, query, limit);

        Pageable pageable = ListLimit.of(limit);
        List<Product> products = (query == null || query.isEmpty())
            ? productRepository.findByTenantId(tenantId, pageable)
            : productRepository.findByTenantIdAndTitleContainingIgnoreCase(tenantId, query, pageable);

        log.debug("Found {} products", products.size());
        return products.stream()
            .map(ProductResponse::from)
            .toList();
    }
}
