package io.budgetmart.ecommerce.application.theme.dto;

import io.budgetmart.ecommerce.domain.theme.ThemeSettings;

import java.util.List;

public record ThemeResponse(
    String tenantId,
    String primaryColor,
    String heroHeading,
    String heroSubtext,
    String logoUrl,
    List<String> featuredCategories
) {
    public static ThemeResponse from(ThemeSettings settings) {
        return new ThemeResponse(
            settings.getTenantId(),
            settings.getPrimaryColor(),
            settings.getHeroHeading(),
            settings.getHeroSubtext(),
            settings.getLogoUrl(),
            settings.getFeaturedCategories()
        );
    }
}
