package io.budgetmart.ecommerce.domain.admin;

/**
 * 관리자 세션 토큰 발급/검증
 * <p>
 * 토큰은 서명되어야 하며, verify는 서명과 만료를 모두 확인한다.
 * 검증 실패 시 UNAUTHORIZED BusinessException을 던진다.
 */
public interface AdminTokenProvider {

    IssuedAdminToken issue(AdminUser adminUser);

    AdminClaims verify(String token);
}
