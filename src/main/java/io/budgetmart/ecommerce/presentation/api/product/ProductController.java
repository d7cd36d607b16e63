package io.budgetmart.ecommerce.presentation.api.product;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.product.dto.AdjustStockRequest;
import io.budgetmart.ecommerce.application.product.dto.CreateProductRequest;
import io.budgetmart.ecommerce.application.product.dto.ProductResponse;
import io.budgetmart.ecommerce.application.usecase.product.AdjustProductStockUseCase;
import io.budgetmart.ecommerce.application.usecase.product.CreateProductUseCase;
import io.budgetmart.ecommerce.application.usecase.product.GetProductUseCase;
import io.budgetmart.ecommerce.application.usecase.product.GetProductsUseCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final CreateProductUseCase createProductUseCase;
    private final GetProductsUseCase getProductsUseCase;
    private final GetProductUseCase getProductUseCase;
    private final AdjustProductStockUseCase adjustProductStockUseCase;

    @PostMapping
    public ResponseEntity<IdResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        return ResponseEntity.ok(createProductUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts(
            @RequestParam("tenant_id") String tenantId,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "100") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getProductsUseCase.execute(tenantId, q, limit));
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(
            @PathVariable String productId,
            @RequestParam("tenant_id") String tenantId
    ) {
        return ResponseEntity.ok(getProductUseCase.execute(tenantId, productId));
    }

    /**
     * 재고 조정 (delta 양수: 입고, 음수: 차감)
     */
    @PatchMapping("/{productId}/stock")
    public ResponseEntity<ProductResponse> adjustStock(
            @PathVariable String productId,
            @RequestParam("tenant_id") String tenantId,
            @Valid @RequestBody AdjustStockRequest request
    ) {
        return ResponseEntity.ok(adjustProductStockUseCase.execute(tenantId, productId, request.delta()));
    }
}
