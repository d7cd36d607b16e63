package io.budgetmart.ecommerce.infrastructure.persistence.admin;

import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.admin.AdminUserRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.InMemoryDocuments;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Repository
@Profile("inmemory")
public class InMemoryAdminUserRepository implements AdminUserRepository {

    private final Map<String, AdminUser> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<AdminUser> findByTenantIdAndEmail(String tenantId, String email) {
        return storage.values().stream()
            .filter(user -> user.getTenantId().equals(tenantId) && user.getEmail().equals(email))
            .findFirst();
    }

    @Override
    public synchronized boolean existsByTenantIdAndEmail(String tenantId, String email) {
        return findByTenantIdAndEmail(tenantId, email).isPresent();
    }

    @Override
    public synchronized AdminUser save(AdminUser adminUser) {
        String id = InMemoryDocuments.prepareForSave(adminUser);
        storage.put(id, adminUser);
        return adminUser;
    }
}
