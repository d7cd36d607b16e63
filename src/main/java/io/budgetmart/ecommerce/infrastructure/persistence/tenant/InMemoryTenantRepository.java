package io.budgetmart.ecommerce.infrastructure.persistence.tenant;

import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.InMemoryDocuments;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Profile("inmemory")
public class InMemoryTenantRepository implements TenantRepository {

    private final Map<String, Tenant> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Tenant> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public synchronized boolean existsById(String id) {
        return storage.containsKey(id);
    }

    @Override
    public synchronized List<Tenant> findAllBy(Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()), tenant -> true, pageable);
    }

    @Override
    public synchronized Tenant save(Tenant tenant) {
        String id = InMemoryDocuments.prepareForSave(tenant);
        storage.put(id, tenant);
        return tenant;
    }
}
