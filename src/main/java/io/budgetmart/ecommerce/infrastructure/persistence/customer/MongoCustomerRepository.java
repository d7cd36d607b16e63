package io.budgetmart.ecommerce.infrastructure.persistence.customer;

import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MongoCustomerRepository extends MongoRepository<Customer, String>, CustomerRepository {

    @Override
    Customer save(Customer customer);

    @Override
    Optional<Customer> findByIdAndTenantId(String id, String tenantId);

    @Override
    List<Customer> findByTenantId(String tenantId, Pageable pageable);

    @Override
    List<Customer> findByTenantIdAndNameContainingIgnoreCase(String tenantId, String name, Pageable pageable);
}
