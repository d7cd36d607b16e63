package io.budgetmart.ecommerce.application.usecase.tenant;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.tenant.dto.TenantResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetTenantsUseCase {

    private final TenantRepository tenantRepository;

    public List<TenantResponse> execute(int limit) {
        List<TenantResponse> tenants = tenantRepository.findAllBy(ListLimit.of(limit)).stream()
            .map(TenantResponse::from)
            .toList();

        log.debug("Found {} tenants", tenants.size());
        return tenants;
    }
}
