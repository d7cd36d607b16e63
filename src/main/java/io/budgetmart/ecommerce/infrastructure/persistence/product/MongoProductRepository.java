package io.budgetmart.ecommerce.infrastructure.persistence.product;

import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MongoProductRepository extends MongoRepository<Product, String>, ProductRepository {

    @Override
    Product save(Product product);

    @Override
    Optional<Product> findByIdAndTenantId(String id, String tenantId);

    @Override
    List<Product> findByTenantId(String tenantId, Pageable pageable);

    @Override
    List<Product> findByTenantIdAndTitleContainingIgnoreCase(String tenantId, String title, Pageable pageable);

    /**
     * 단일 문서 조건부 $inc
     * <p>
     * 필터에 재고 범위 조건을 포함하므로 확인과 증감이 한 번의 연산으로 처리된다.
     * 상한 조건이 있어 stock 필드가 int64로 넓어지지 않는다.
     * 조건이 맞지 않으면 0을 반환하고 문서는 변경되지 않는다.
     */
    @Override
    @Query("{ '_id': ?0, 'stock': { '$gte': ?1, '$lte': ?2 } }")
    @Update("{ '$inc': { 'stock': ?3 } }")
    long incrementStockIfWithin(String id, int minimumStock, int maximumStock, int delta);
}
