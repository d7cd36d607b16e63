package io.budgetmart.ecommerce.presentation.api.customer;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.customer.dto.CreateCustomerRequest;
import io.budgetmart.ecommerce.application.customer.dto.CustomerResponse;
import io.budgetmart.ecommerce.application.usecase.customer.CreateCustomerUseCase;
import io.budgetmart.ecommerce.application.usecase.customer.GetCustomersUseCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CreateCustomerUseCase createCustomerUseCase;
    private final GetCustomersUseCase getCustomersUseCase;

    @PostMapping
    public ResponseEntity<IdResponse> createCustomer(@Valid @RequestBody CreateCustomerRequest request) {
        return ResponseEntity.ok(createCustomerUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<CustomerResponse>> getCustomers(
            @RequestParam("tenant_id") String tenantId,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "100") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getCustomersUseCase.execute(tenantId, q, limit));
    }
}
