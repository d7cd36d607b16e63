package io.budgetmart.ecommerce.domain.customer;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface CustomerRepository {

    Optional<Customer> findByIdAndTenantId(String id, String tenantId);

    List<Customer> findByTenantId(String tenantId, Pageable pageable);

    List<Customer> findByTenantIdAndNameContainingIgnoreCase(String tenantId, String name, Pageable pageable);

    Customer save(Customer customer);

    default Customer findByIdAndTenantIdOrThrow(String id, String tenantId) {
        return findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CUSTOMER_NOT_FOUND,
                "고객을 찾을 수 없습니다. customerId: " + id
            ));
    }
}
