package io.budgetmart.ecommerce.application.customer.dto;

import io.budgetmart.ecommerce.domain.customer.Customer;

public record CustomerResponse(
    String id,
    String tenantId,
    String name,
    String email
) {
    public static CustomerResponse from(Customer customer) {
        return new CustomerResponse(
            customer.getId(),
            customer.getTenantId(),
            customer.getName(),
            customer.getEmail()
        );
    }
}
