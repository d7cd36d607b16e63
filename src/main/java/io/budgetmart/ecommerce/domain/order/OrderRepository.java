package io.budgetmart.ecommerce.domain.order;

import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    Optional<Order> findById(String id);

    List<Order> findByTenantId(String tenantId, Pageable pageable);

    Order save(Order order);
}
