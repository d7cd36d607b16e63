package io.budgetmart.ecommerce.application.usecase.tenant;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.tenant.dto.CreateTenantRequest;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateTenantUseCase {

    private final TenantRepository tenantRepository;

    public IdResponse execute(CreateTenantRequest request) {
        Tenant tenant = Tenant.create(request.name(), request.domain(), request.plan(), request.contactEmail());
        Tenant saved = tenantRepository.save(tenant);

        log.info("Tenant created. tenantId: {}, name: {}, plan: {}", saved.getId(), saved.getName(), saved.getPlan());
        return IdResponse.of(saved.getId());
    }
}
