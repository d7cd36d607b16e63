package io.budgetmart.ecommerce.presentation.api.tenant;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.tenant.dto.CreateTenantRequest;
import io.budgetmart.ecommerce.application.tenant.dto.TenantResponse;
import io.budgetmart.ecommerce.application.usecase.tenant.CreateTenantUseCase;
import io.budgetmart.ecommerce.application.usecase.tenant.GetTenantsUseCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
public class TenantController {

    private final CreateTenantUseCase createTenantUseCase;
    private final GetTenantsUseCase getTenantsUseCase;

    @PostMapping
    public ResponseEntity<IdResponse> createTenant(@Valid @RequestBody CreateTenantRequest request) {
        return ResponseEntity.ok(createTenantUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<TenantResponse>> getTenants(
            @RequestParam(defaultValue = "50") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getTenantsUseCase.execute(limit));
    }
}
