package io.budgetmart.ecommerce.domain.common;

import lombok.Getter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;

import java.time.LocalDateTime;

/**
 * BaseTimeDocument
 *
 * Spring Data Mongo Auditing으로 created_at / updated_at을 관리한다.
 * - MongoDB: @EnableMongoAuditing (MongoAuditingConfig)
 * - inmemory 프로필: InMemoryDocuments가 저장 시점에 직접 기록
 */
@Getter
public abstract class BaseTimeDocument {

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
