package io.budgetmart.ecommerce.infrastructure.persistence.order;

import io.budgetmart.ecommerce.domain.order.Order;
import io.budgetmart.ecommerce.domain.order.OrderRepository;
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
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<String, Order> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Order> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public synchronized List<Order> findByTenantId(String tenantId, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            order -> order.getTenantId().equals(tenantId), pageable);
    }

    @Override
    public synchronized Order save(Order order) {
        String id = InMemoryDocuments.prepareForSave(order);
        storage.put(id, order);
        return order;
    }

    public synchronized List<Order> findAll() {
        return new ArrayList<>(storage.values());
    }
}
