package io.budgetmart.ecommerce.application.usecase.customer;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.customer.dto.CreateCustomerRequest;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateCustomerUseCase {

    private final TenantRepository tenantRepository;
    private final CustomerRepository customerRepository;

    public IdResponse execute(CreateCustomerRequest request) {
        tenantRepository.verifyExists(request.tenantId());

        Customer saved = customerRepository.save(
            Customer.create(request.tenantId(), request.name(), request.email())
        );

        log.info("Customer created. tenantId: {}, customerId: {}", saved.getTenantId(), saved.getId());
        return IdResponse.of(saved.getId());
    }
}
