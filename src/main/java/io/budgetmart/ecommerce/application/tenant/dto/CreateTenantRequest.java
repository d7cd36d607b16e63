package io.budgetmart.ecommerce.application.tenant.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CreateTenantRequest(
    @NotBlank(message = "테넌트 이름은 필수입니다")
    String name,
    String domain,
    String plan,
    @Email(message = "올바른 이메일 형식이 아닙니다")
    String contactEmail
) {
}
