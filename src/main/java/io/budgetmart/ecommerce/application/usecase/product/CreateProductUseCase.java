package io.budgetmart.ecommerce.application.usecase.product;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.product.dto.CreateProductRequest;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateProductUseCase {

    private final TenantRepository tenantRepository;
    private final ProductRepository productRepository;

    public IdResponse execute(CreateProductRequest request) {
        tenantRepository.verifyExists(request.tenantId());

        Product product = Product.create(
            request.tenantId(),
            request.title(),
            request.description(),
            request.price(),
            request.image(),
            request.stock(),
            request.category(),
            request.isActive()
        );
        Product saved = productRepository.save(product);

        log.info("Product created. tenantId: {}, productId: {}, stock: {}",
            saved.getTenantId(), saved.getId(), saved.getStock());
        return IdResponse.of(saved.getId());
    }
}
