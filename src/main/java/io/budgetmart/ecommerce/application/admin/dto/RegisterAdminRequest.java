package io.budgetmart.ecommerce.application.admin.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * @param role owner | staff (생략 시 owner)
 */
public record RegisterAdminRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "관리자 이메일은 필수입니다")
    @Email(message = "올바른 이메일 형식이 아닙니다")
    String email,

    @NotBlank(message = "비밀번호는 필수입니다")
    String password,

    String role
) {
}
