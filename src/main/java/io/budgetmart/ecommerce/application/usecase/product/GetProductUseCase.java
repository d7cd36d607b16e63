package io.budgetmart.ecommerce.application.usecase.product;

import io.budgetmart.ecommerce.application.product.dto.ProductResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.common.DocumentIds;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetProductUseCase {

    private final ProductRepository productRepository;

    public ProductResponse execute(String tenantId, String productId) {
        log.info("Getting product detail. tenantId: {}, productId: {}", tenantId, productId);

        DocumentIds.validate(productId);
        return ProductResponse.from(productRepository.findByIdAndTenantIdOrThrow(productId, tenantId));
    }
}
