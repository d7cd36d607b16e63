package io.budgetmart.ecommerce.application.admin.dto;

import io.budgetmart.ecommerce.domain.admin.AdminRole;
import io.budgetmart.ecommerce.domain.admin.IssuedAdminToken;

import java.time.Instant;

public record LoginAdminResponse(
    String token,
    String tokenType,
    String tenantId,
    AdminRole role,
    Instant expiresAt
) {
    public static LoginAdminResponse from(IssuedAdminToken issued) {
        return new LoginAdminResponse(
            issued.token(),
            "Bearer",
            issued.claims().tenantId(),
            issued.claims().role(),
            issued.claims().expiresAt()
        );
    }
}
