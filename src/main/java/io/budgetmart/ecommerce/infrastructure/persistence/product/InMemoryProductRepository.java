package io.budgetmart.ecommerce.infrastructure.persistence.product;

import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.InMemoryDocuments;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Profile("inmemory")
public class InMemoryProductRepository implements ProductRepository {

    private final Map<String, Product> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Product> findByIdAndTenantId(String id, String tenantId) {
        return Optional.ofNullable(storage.get(id))
            .filter(product -> product.getTenantId().equals(tenantId));
    }

    @Override
    public synchronized List<Product> findByTenantId(String tenantId, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            product -> product.getTenantId().equals(tenantId), pageable);
    }

    @Override
    public synchronized List<Product> findByTenantIdAndTitleContainingIgnoreCase(String tenantId, String title,
                                                                                 Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            product -> product.getTenantId().equals(tenantId)
                && InMemoryDocuments.containsIgnoreCase(product.getTitle(), title),
            pageable);
    }

    @Override
    public synchronized Product save(Product product) {
        String id = InMemoryDocuments.prepareForSave(product);
        storage.put(id, product);
        return product;
    }

    @Override
    public synchronized long incrementStockIfWithin(String id, int minimumStock, int maximumStock, int delta) {
        Product product = storage.get(id);
        if (product == null || product.getStock() < minimumStock || product.getStock() > maximumStock) {
            return 0;
        }
        product.adjustStock(delta);
        InMemoryDocuments.prepareForSave(product);
        return 1;
    }

    public synchronized Optional<Product> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }
}
