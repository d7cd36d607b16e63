package io.budgetmart.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.budgetmart.ecommerce.domain.product.Product;

import java.math.BigDecimal;

public record ProductResponse(
    String id,
    String tenantId,
    String title,
    String description,
    BigDecimal price,
    String image,
    int stock,
    String category,
    @JsonProperty("is_active")
    boolean isActive
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(
            product.getId(),
            product.getTenantId(),
            product.getTitle(),
            product.getDescription(),
            product.getPrice(),
            product.getImage(),
            product.getStock(),
            product.getCategory(),
            product.isActive()
        );
    }
}
