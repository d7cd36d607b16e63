package io.budgetmart.ecommerce.application.customer.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CreateCustomerRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "고객 이름은 필수입니다")
    String name,

    @NotBlank(message = "고객 이메일은 필수입니다")
    @Email(message = "올바른 이메일 형식이 아닙니다")
    String email
) {
}
