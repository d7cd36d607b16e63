package io.budgetmart.ecommerce.infrastructure.persistence.theme;

import io.budgetmart.ecommerce.domain.theme.ThemeSettings;
import io.budgetmart.ecommerce.domain.theme.ThemeSettingsRepository;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MongoThemeSettingsRepository extends MongoRepository<ThemeSettings, String>, ThemeSettingsRepository {

    @Override
    ThemeSettings save(ThemeSettings themeSettings);

    @Override
    Optional<ThemeSettings> findByTenantId(String tenantId);
}
