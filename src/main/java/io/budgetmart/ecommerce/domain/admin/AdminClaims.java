package io.budgetmart.ecommerce.domain.admin;

import java.time.Instant;

/**
 * 관리자 토큰에 담기는 세션 정보
 */
public record AdminClaims(
    String tenantId,
    String email,
    AdminRole role,
    Instant expiresAt
) {
}
