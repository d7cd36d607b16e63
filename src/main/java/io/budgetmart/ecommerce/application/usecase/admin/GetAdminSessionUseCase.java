package io.budgetmart.ecommerce.application.usecase.admin;

import io.budgetmart.ecommerce.application.admin.dto.AdminSessionResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.admin.AdminTokenProvider;
import lombok.RequiredArgsConstructor;

/**
 * Authorization: Bearer 토큰 검증 후 세션 정보 반환
 */
@UseCase
@RequiredArgsConstructor
public class GetAdminSessionUseCase {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AdminTokenProvider adminTokenProvider;

    public AdminSessionResponse execute(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "Bearer 토큰이 필요합니다");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return AdminSessionResponse.from(adminTokenProvider.verify(token));
    }
}
