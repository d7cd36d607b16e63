package io.budgetmart.ecommerce.application.usecase.theme;

import io.budgetmart.ecommerce.application.theme.dto.ThemeResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.theme.ThemeSettings;
import io.budgetmart.ecommerce.domain.theme.ThemeSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 테마 조회
 * 저장된 설정이 없으면 기본 테마를 돌려준다 (404 없음).
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetThemeUseCase {

    private final ThemeSettingsRepository themeSettingsRepository;

    public ThemeResponse execute(String tenantId) {
        ThemeSettings settings = themeSettingsRepository.findByTenantId(tenantId)
            .orElseGet(() -> {
                log.debug("No theme stored, using defaults. tenantId: {}", tenantId);
                return ThemeSettings.defaults(tenantId);
            });
        return ThemeResponse.from(settings);
    }
}
