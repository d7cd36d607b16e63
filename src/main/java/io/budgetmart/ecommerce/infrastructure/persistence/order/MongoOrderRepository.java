package io.budgetmart.ecommerce.infrastructure.persistence.order;

import io.budgetmart.ecommerce.domain.order.Order;
import io.budgetmart.ecommerce.domain.order.OrderRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MongoOrderRepository extends MongoRepository<Order, String>, OrderRepository {

    @Override
    Optional<Order> findById(String id);

    @Override
    Order save(Order order);

    @Override
    List<Order> findByTenantId(String tenantId, Pageable pageable);
}
