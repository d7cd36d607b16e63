package io.budgetmart.ecommerce.infrastructure.persistence.theme;

import io.budgetmart.ecommerce.domain.theme.ThemeSettings;
import io.budgetmart.ecommerce.domain.theme.ThemeSettingsRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.InMemoryDocuments;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Repository
@Profile("inmemory")
public class InMemoryThemeSettingsRepository implements ThemeSettingsRepository {

    // tenant_id 유니크 인덱스와 같은 효과를 내도록 tenantId를 키로 사용
    private final Map<String, ThemeSettings> storageByTenant = new LinkedHashMap<>();

    @Override
    public synchronized Optional<ThemeSettings> findByTenantId(String tenantId) {
        return Optional.ofNullable(storageByTenant.get(tenantId));
    }

    @Override
    public synchronized ThemeSettings save(ThemeSettings themeSettings) {
        InMemoryDocuments.prepareForSave(themeSettings);
        storageByTenant.put(themeSettings.getTenantId(), themeSettings);
        return themeSettings;
    }
}
