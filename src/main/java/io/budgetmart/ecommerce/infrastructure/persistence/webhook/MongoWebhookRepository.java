package io.budgetmart.ecommerce.infrastructure.persistence.webhook;

import io.budgetmart.ecommerce.domain.webhook.Webhook;
import io.budgetmart.ecommerce.domain.webhook.WebhookRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MongoWebhookRepository extends MongoRepository<Webhook, String>, WebhookRepository {

    @Override
    Webhook save(Webhook webhook);

    @Override
    List<Webhook> findByTenantIdAndActiveTrue(String tenantId);

    @Override
    List<Webhook> findByTenantId(String tenantId, Pageable pageable);

    @Override
    List<Webhook> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable);
}
