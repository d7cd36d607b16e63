package io.budgetmart.ecommerce.domain.webhook;

import org.springframework.data.domain.Pageable;

import java.util.List;

public interface WebhookRepository {

    List<Webhook> findByTenantIdAndActiveTrue(String tenantId);

    List<Webhook> findByTenantId(String tenantId, Pageable pageable);

    List<Webhook> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable);

    Webhook save(Webhook webhook);
}
