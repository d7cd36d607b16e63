package io.budgetmart.ecommerce.presentation.common;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;

/**
 * 공통 에러 응답 {code, message, details}
 *
 * @param details 검증 실패 시 필드별 메시지, 그 외에는 null
 */
public record ErrorResponse(
    String code,
    String message,
    Object details
) {
    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), null);
    }

    public static ErrorResponse of(ErrorCode errorCode, Object details) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage(), details);
    }

    public static ErrorResponse from(BusinessException e) {
        return new ErrorResponse(e.getCode(), e.getMessage(), null);
    }
}
