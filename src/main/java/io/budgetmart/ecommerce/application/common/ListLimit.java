package io.budgetmart.ecommerce.application.common;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

/**
 * 목록 API의 limit 파라미터를 첫 페이지 Pageable로 변환
 */
public final class ListLimit {

    public static final int DEFAULT = 100;
    public static final int TENANT_DEFAULT = 50;

    private ListLimit() {
    }

    public static Pageable of(int limit) {
        if (limit < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "limit은 1 이상이어야 합니다. limit: " + limit);
        }
        return PageRequest.of(0, limit);
    }
}
