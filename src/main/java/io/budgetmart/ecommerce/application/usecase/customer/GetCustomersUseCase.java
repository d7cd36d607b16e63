package io.budgetmart.ecommerce.application.usecase.customer;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.customer.dto.CustomerResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetCustomersUseCase {

    private final CustomerRepository customerRepository;

    public List<CustomerResponse> execute(String tenantId, String query, int limit) {
        Pageable pageable = ListLimit.of(limit);
        List<Customer> customers = (query == null || query.isEmpty())
            ? customerRepository.findByTenantId(tenantId, pageable)
            : customerRepository.findByTenantIdAndNameContainingIgnoreCase(tenantId, query, pageable);

        log.debug("Found {} customers for tenantId: {}", customers.size(), tenantId);
        return customers.stream()
            .map(CustomerResponse::from)
            .toList();
    }
}
