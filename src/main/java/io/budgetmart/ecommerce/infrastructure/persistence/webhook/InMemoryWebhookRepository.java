package io.budgetmart.ecommerce.infrastructure.persistence.webhook;

import io.budgetmart.ecommerce.domain.webhook.Webhook;
import io.budgetmart.ecommerce.domain.webhook.WebhookRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.InMemoryDocuments;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Repository
@Profile("inmemory")
public class InMemoryWebhookRepository implements WebhookRepository {

    private final Map<String, Webhook> storage = new LinkedHashMap<>();

    @Override
    public synchronized List<Webhook> findByTenantIdAndActiveTrue(String tenantId) {
        return storage.values().stream()
            .filter(webhook -> webhook.getTenantId().equals(tenantId) && webhook.isActive())
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Webhook> findByTenantId(String tenantId, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            webhook -> webhook.getTenantId().equals(tenantId), pageable);
    }

    @Override
    public synchronized List<Webhook> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            webhook -> webhook.getTenantId().equals(tenantId) && webhook.isActive() == active, pageable);
    }

    @Override
    public synchronized Webhook save(Webhook webhook) {
        String id = InMemoryDocuments.prepareForSave(webhook);
        storage.put(id, webhook);
        return webhook;
    }
}
