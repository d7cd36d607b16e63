package io.budgetmart.ecommerce.application.admin.dto;

import io.budgetmart.ecommerce.domain.admin.AdminClaims;
import io.budgetmart.ecommerce.domain.admin.AdminRole;

import java.time.Instant;

public record AdminSessionResponse(
    String tenantId,
    String email,
    AdminRole role,
    Instant expiresAt
) {
    public static AdminSessionResponse from(AdminClaims claims) {
        return new AdminSessionResponse(claims.tenantId(), claims.email(), claims.role(), claims.expiresAt());
    }
}
