package io.budgetmart.ecommerce.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * created_at / updated_at 자동 기록
 * inmemory 프로필은 InMemoryDocuments가 직접 기록한다.
 */
@Configuration
@Profile("!inmemory")
@EnableMongoAuditing
public class MongoAuditingConfig {
}
