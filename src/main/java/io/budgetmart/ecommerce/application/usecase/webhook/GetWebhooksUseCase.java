package io.budgetmart.ecommerce.application.usecase.webhook;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.application.webhook.dto.WebhookResponse;
import io.budgetmart.ecommerce.domain.webhook.Webhook;
import io.budgetmart.ecommerce.domain.webhook.WebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetWebhooksUseCase {

    private final WebhookRepository webhookRepository;

    public List<WebhookResponse> execute(String tenantId, Boolean active, int limit) {
        Pageable pageable = ListLimit.of(limit);
        List<Webhook> webhooks = active == null
            ? webhookRepository.findByTenantId(tenantId, pageable)
            : webhookRepository.findByTenantIdAndActive(tenantId, active, pageable);

        log.debug("Found {} webhooks for tenantId: {}", webhooks.size(), tenantId);
        return webhooks.stream()
            .map(WebhookResponse::from)
            .toList();
    }
}
