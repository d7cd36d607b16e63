package io.budgetmart.ecommerce.application.webhook.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Set;

public record CreateWebhookRequest(
    @NotBlank(message = "테넌트 ID는 필수입니다")
    String tenantId,

    @NotBlank(message = "웹훅 URL은 필수입니다")
    String url,

    Set<String> events,

    Boolean active
) {
}
