package io.budgetmart.ecommerce.application.product.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record CreateProductRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "상품명은 필수입니다")
    String title,

    String description,

    @NotNull(message = "가격은 필수입니다")
    @DecimalMin(value = "0", message = "가격은 0 이상이어야 합니다")
    BigDecimal price,

    String image,

    @PositiveOrZero(message = "재고는 0 이상이어야 합니다")
    Integer stock,

    String category,

    @JsonProperty("is_active")
    Boolean isActive
) {
}
