package io.budgetmart.ecommerce.application.tenant.dto;

import io.budgetmart.ecommerce.domain.tenant.Tenant;

import java.time.LocalDateTime;

public record TenantResponse(
    String id,
    String name,
    String domain,
    String plan,
    String contactEmail,
    LocalDateTime createdAt
) {
    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(
            tenant.getId(),
            tenant.getName(),
            tenant.getDomain(),
            tenant.getPlan(),
            tenant.getContactEmail(),
            tenant.getCreatedAt()
        );
    }
}
