package io.budgetmart.ecommerce.application.usecase.theme;

import io.budgetmart.ecommerce.application.theme.dto.SaveThemeRequest;
import io.budgetmart.ecommerce.application.theme.dto.ThemeResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import io.budgetmart.ecommerce.domain.theme.ThemeSettings;
import io.budgetmart.ecommerce.domain.theme.ThemeSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;

/**
 * 테마 저장 (tenant_id 기준 upsert)
 * <p>
 * 기존 문서가 있으면 모든 필드를 교체하고, 없으면 새로 만든다.
 * 동시 최초 저장으로 유니크 인덱스 충돌이 나면 저장된 문서를 다시 읽어 교체한다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class SaveThemeUseCase {

    private final TenantRepository tenantRepository;
    private final ThemeSettingsRepository themeSettingsRepository;

    public ThemeResponse execute(SaveThemeRequest request) {
        tenantRepository.verifyExists(request.tenantId());

        ThemeSettings saved;
        try {
            saved = upsert(request);
        } catch (DuplicateKeyException e) {
            log.info("Concurrent theme insert detected, retrying as replace. tenantId: {}", request.tenantId());
            saved = upsert(request);
        }

        log.info("Theme saved. tenantId: {}", saved.getTenantId());
        return ThemeResponse.from(saved);
    }

    private ThemeSettings upsert(SaveThemeRequest request) {
        ThemeSettings settings = themeSettingsRepository.findByTenantId(request.tenantId())
            .map(existing -> {
                existing.replace(
                    request.primaryColor(),
                    request.heroHeading(),
                    request.heroSubtext(),
                    request.logoUrl(),
                    request.featuredCategories()
                );
                return existing;
            })
            .orElseGet(() -> ThemeSettings.create(
                request.tenantId(),
                request.primaryColor(),
                request.heroHeading(),
                request.heroSubtext(),
                request.logoUrl(),
                request.featuredCategories()
            ));
        return themeSettingsRepository.save(settings);
    }
}
