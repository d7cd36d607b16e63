package io.budgetmart.ecommerce.application.usecase.admin;

import io.budgetmart.ecommerce.application.admin.dto.LoginAdminRequest;
import io.budgetmart.ecommerce.application.admin.dto.LoginAdminResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.admin.AdminTokenProvider;
import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.admin.AdminUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 관리자 로그인
 * <p>
 * 계정이 없을 때와 비밀번호가 틀릴 때 같은 응답을 돌려준다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class LoginAdminUseCase {

    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final AdminTokenProvider adminTokenProvider;

    public LoginAdminResponse execute(LoginAdminRequest request) {
        AdminUser adminUser = adminUserRepository.findByTenantIdAndEmail(request.tenantId(), request.email())
            .filter(user -> passwordEncoder.matches(request.password(), user.getPasswordHash()))
            .orElseThrow(() -> {
                log.warn("Admin login failed. tenantId: {}", request.tenantId());
                return new BusinessException(ErrorCode.UNAUTHORIZED, "이메일 또는 비밀번호가 올바르지 않습니다");
            });

        log.info("Admin logged in. tenantId: {}, adminId: {}", adminUser.getTenantId(), adminUser.getId());
        return LoginAdminResponse.from(adminTokenProvider.issue(adminUser));
    }
}
