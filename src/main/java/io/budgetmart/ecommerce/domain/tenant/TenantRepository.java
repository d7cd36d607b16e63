package io.budgetmart.ecommerce.domain.tenant;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.DocumentIds;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

public interface TenantRepository {

    Optional<Tenant> findById(String id);

    boolean existsById(String id);

    List<Tenant> findAllBy(Pageable pageable);

    Tenant save(Tenant tenant);

    /**
     * 테넌트 소유 리소스를 만들기 전에 호출하는 존재 확인
     * - 형식 오류: INVALID_INPUT (400)
     * - 미존재: TENANT_NOT_FOUND (404)
     */
    default void verifyExists(String tenantId) {
        DocumentIds.validate(tenantId);
        if (!existsById(tenantId)) {
            throw new BusinessException(
                ErrorCode.TENANT_NOT_FOUND,
                "테넌트를 찾을 수 없습니다. tenantId: " + tenantId
            );
        }
    }
}
