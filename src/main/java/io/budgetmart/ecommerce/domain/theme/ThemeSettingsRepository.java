package io.budgetmart.ecommerce.domain.theme;

import java.util.Optional;

public interface ThemeSettingsRepository {

    Optional<ThemeSettings> findByTenantId(String tenantId);

    ThemeSettings save(ThemeSettings themeSettings);
}
