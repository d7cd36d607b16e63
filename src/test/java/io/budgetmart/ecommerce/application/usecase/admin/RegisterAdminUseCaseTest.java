package io.budgetmart.ecommerce.application.usecase.admin;

import io.budgetmart.ecommerce.application.admin.dto.RegisterAdminRequest;
import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.admin.AdminRole;
import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.infrastructure.persistence.admin.InMemoryAdminUserRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.tenant.InMemoryTenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.assertj.core.api.Assertions.*;

class RegisterAdminUseCaseTest {

    private final PasswordEncoder passwordEncoder = PasswordEncoderFactories.createDelegatingPasswordEncoder();

    private InMemoryAdminUserRepository adminUserRepository;
    private RegisterAdminUseCase registerAdminUseCase;
    private String tenantId;

    @BeforeEach
    void setUp() {
        InMemoryTenantRepository tenantRepository = new InMemoryTenantRepository();
        adminUserRepository = new InMemoryAdminUserRepository();
        registerAdminUseCase = new RegisterAdminUseCase(tenantRepository, adminUserRepository, passwordEncoder);
        tenantId = tenantRepository.save(Tenant.create("Shop", null, null, null)).getId();
    }

    @Test
    @DisplayName("비밀번호는 해시로만 저장되고 역할 생략 시 owner")
    void execute_성공() {
        // When
        IdResponse response = registerAdminUseCase.execute(
            new RegisterAdminRequest(tenantId, "owner@shop.com", "s3cret!", null));

        // Then
        AdminUser saved = adminUserRepository.findByTenantIdAndEmail(tenantId, "owner@shop.com").orElseThrow();
        assertThat(saved.getId()).isEqualTo(response.id());
        assertThat(saved.getRole()).isEqualTo(AdminRole.OWNER);
        assertThat(saved.getPasswordHash()).isNotEqualTo("s3cret!");
        assertThat(passwordEncoder.matches("s3cret!", saved.getPasswordHash())).isTrue();
    }

    @Test
    @DisplayName("같은 테넌트의 중복 이메일 - DUPLICATE_USER")
    void execute_중복이메일_예외발생() {
        // Given
        registerAdminUseCase.execute(new RegisterAdminRequest(tenantId, "owner@shop.com", "pw", "owner"));

        // When & Then
        assertThatThrownBy(() -> registerAdminUseCase.execute(
                new RegisterAdminRequest(tenantId, "owner@shop.com", "other", "staff")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.DUPLICATE_USER);
    }

    @Test
    @DisplayName("알 수 없는 역할 - INVALID_INPUT")
    void execute_잘못된역할_예외발생() {
        assertThatThrownBy(() -> registerAdminUseCase.execute(
                new RegisterAdminRequest(tenantId, "owner@shop.com", "pw", "superuser")))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("존재하지 않는 테넌트 - TENANT_NOT_FOUND")
    void execute_테넌트없음_예외발생() {
        assertThatThrownBy(() -> registerAdminUseCase.execute(
                new RegisterAdminRequest("665f1c2e9b1d8a3f4c2e1aff", "owner@shop.com", "pw", null)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.TENANT_NOT_FOUND);
    }
}
