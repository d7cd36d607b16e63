package io.budgetmart.ecommerce.infrastructure.persistence.tenant;

import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MongoTenantRepository extends MongoRepository<Tenant, String>, TenantRepository {

    // Explicitly declare methods to resolve ambiguity with TenantRepository
    @Override
    Optional<Tenant> findById(String id);

    @Override
    boolean existsById(String id);

    @Override
    Tenant save(Tenant tenant);

    @Override
    List<Tenant> findAllBy(Pageable pageable);
}
