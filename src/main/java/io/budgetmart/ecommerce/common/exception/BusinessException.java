package io.budgetmart.ecommerce.common.exception;

import lombok.Getter;

/**
 * 도메인 규칙 위반 예외
 * <p>
 * 도메인 팩토리, 저장소의 ...OrThrow 헬퍼, 유스케이스에서 던지고
 * GlobalExceptionHandler가 ErrorCode에 맞는 HTTP 상태로 한 번만 변환한다.
 * 메시지를 생략하면 ErrorCode의 기본 메시지를 쓴다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage());
    }

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 응답 본문의 code 값 (예: P002)
     */
    public String getCode() {
        return errorCode.getCode();
    }
}
