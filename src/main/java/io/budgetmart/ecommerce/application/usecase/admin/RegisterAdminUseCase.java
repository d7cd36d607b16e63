package io.budgetmart.ecommerce.application.usecase.admin;

import io.budgetmart.ecommerce.application.admin.dto.RegisterAdminRequest;
import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.admin.AdminRole;
import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.admin.AdminUserRepository;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class RegisterAdminUseCase {

    private final TenantRepository tenantRepository;
    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;

    public IdResponse execute(RegisterAdminRequest request) {
        tenantRepository.verifyExists(request.tenantId());
        AdminRole role = AdminRole.from(request.role());

        if (adminUserRepository.existsByTenantIdAndEmail(request.tenantId(), request.email())) {
            throw duplicate(request);
        }

        AdminUser adminUser = AdminUser.create(
            request.tenantId(),
            request.email(),
            passwordEncoder.encode(request.password()),
            role
        );

        try {
            AdminUser saved = adminUserRepository.save(adminUser);
            log.info("Admin registered. tenantId: {}, adminId: {}, role: {}",
                saved.getTenantId(), saved.getId(), saved.getRole());
            return IdResponse.of(saved.getId());
        } catch (DuplicateKeyException e) {
            throw duplicate(request);
        }
    }

    private BusinessException duplicate(RegisterAdminRequest request) {
        log.warn("Duplicate admin email. tenantId: {}", request.tenantId());
        return new BusinessException(ErrorCode.DUPLICATE_USER, "이미 등록된 관리자입니다. email: " + request.email());
    }
}
