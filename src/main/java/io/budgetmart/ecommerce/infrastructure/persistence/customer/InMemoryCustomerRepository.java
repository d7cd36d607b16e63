package io.budgetmart.ecommerce.infrastructure.persistence.customer;

import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
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
public class InMemoryCustomerRepository implements CustomerRepository {

    private final Map<String, Customer> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Customer> findByIdAndTenantId(String id, String tenantId) {
        return Optional.ofNullable(storage.get(id))
            .filter(customer -> customer.getTenantId().equals(tenantId));
    }

    @Override
    public synchronized List<Customer> findByTenantId(String tenantId, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            customer -> customer.getTenantId().equals(tenantId), pageable);
    }

    @Override
    public synchronized List<Customer> findByTenantIdAndNameContainingIgnoreCase(String tenantId, String name,
                                                                                 Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            customer -> customer.getTenantId().equals(tenantId)
                && InMemoryDocuments.containsIgnoreCase(customer.getName(), name),
            pageable);
    }

    @Override
    public synchronized Customer save(Customer customer) {
        String id = InMemoryDocuments.prepareForSave(customer);
        storage.put(id, customer);
        return customer;
    }
}
