package io.budgetmart.ecommerce.domain.admin;

/**
 * 발급된 토큰 문자열과 그 안에 담긴 클레임
 */
public record IssuedAdminToken(
    String token,
    AdminClaims claims
) {
}
