package io.budgetmart.ecommerce.application.admin.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginAdminRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "관리자 이메일은 필수입니다")
    String email,

    @NotBlank(message = "비밀번호는 필수입니다")
    String password
) {
}
