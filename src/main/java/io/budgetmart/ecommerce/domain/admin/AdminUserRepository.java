package io.budgetmart.ecommerce.domain.admin;

import java.util.Optional;

public interface AdminUserRepository {

    Optional<AdminUser> findByTenantIdAndEmail(String tenantId, String email);

    boolean existsByTenantIdAndEmail(String tenantId, String email);

    AdminUser save(AdminUser adminUser);
}
