package io.budgetmart.ecommerce.application.common.dto;

/**
 * 생성 API 공통 응답 ({"id": ...})
 */
public record IdResponse(
    String id
) {
    public static IdResponse of(String id) {
        return new IdResponse(id);
    }
}
