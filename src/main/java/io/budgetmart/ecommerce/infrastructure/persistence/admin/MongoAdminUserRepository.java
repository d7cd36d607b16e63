package io.budgetmart.ecommerce.infrastructure.persistence.admin;

import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.admin.AdminUserRepository;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MongoAdminUserRepository extends MongoRepository<AdminUser, String>, AdminUserRepository {

    @Override
    AdminUser save(AdminUser adminUser);

    @Override
    Optional<AdminUser> findByTenantIdAndEmail(String tenantId, String email);

    @Override
    boolean existsByTenantIdAndEmail(String tenantId, String email);
}
