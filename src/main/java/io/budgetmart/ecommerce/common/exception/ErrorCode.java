package io.budgetmart.ecommerce.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * HTTP 상태 매핑은 GlobalExceptionHandler에서 담당한다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 테넌트 관련 (T)
    // ====================================
    TENANT_NOT_FOUND("T001", "테넌트를 찾을 수 없습니다"),

    // ====================================
    // 상품 관련 (P)
    // ====================================
    PRODUCT_NOT_FOUND("P001", "상품을 찾을 수 없습니다"),
    INSUFFICIENT_STOCK("P002", "재고가 부족합니다"),

    // ====================================
    // 고객 관련 (CU)
    // ====================================
    CUSTOMER_NOT_FOUND("CU001", "고객을 찾을 수 없습니다"),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    INVALID_QUANTITY("O001", "수량은 1 이상이어야 합니다"),

    // ====================================
    // 쿠폰 관련 (C)
    // ====================================
    INVALID_COUPON("C002", "유효하지 않은 쿠폰입니다"),
    DUPLICATE_COUPON("C005", "이미 존재하는 쿠폰 코드입니다"),

    // ====================================
    // 관리자 인증 관련 (A)
    // ====================================
    DUPLICATE_USER("A001", "이미 등록된 관리자입니다"),
    UNAUTHORIZED("A002", "인증에 실패했습니다"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다"),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다"),
    RESOURCE_NOT_FOUND("COMMON003", "요청한 경로를 찾을 수 없습니다"),
    METHOD_NOT_ALLOWED("COMMON004", "지원하지 않는 HTTP 메서드입니다");

    private final String code;
    private final String message;
}
