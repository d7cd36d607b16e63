package io.budgetmart.ecommerce.application.usecase.webhook;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.application.webhook.dto.CreateWebhookRequest;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import io.budgetmart.ecommerce.domain.webhook.Webhook;
import io.budgetmart.ecommerce.domain.webhook.WebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateWebhookUseCase {

    private final TenantRepository tenantRepository;
    private final WebhookRepository webhookRepository;

    public IdResponse execute(CreateWebhookRequest request) {
        tenantRepository.verifyExists(request.tenantId());

        Webhook saved = webhookRepository.save(
            Webhook.create(request.tenantId(), request.url(), request.events(), request.active())
        );

        log.info("Webhook registered. tenantId: {}, webhookId: {}, url: {}",
            saved.getTenantId(), saved.getId(), saved.getUrl());
        return IdResponse.of(saved.getId());
    }
}
