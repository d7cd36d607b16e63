package io.budgetmart.ecommerce.application.theme.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record SaveThemeRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,
    String primaryColor,
    String heroHeading,
    String heroSubtext,
    String logoUrl,
    List<String> featuredCategories
) {
}
