package io.budgetmart.ecommerce.infrastructure.persistence.coupon;

import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
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
public class InMemoryCouponRepository implements CouponRepository {

    private final Map<String, Coupon> storage = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Coupon> findById(String id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public synchronized Optional<Coupon> findByTenantIdAndCodeAndActiveTrue(String tenantId, String code) {
        return storage.values().stream()
            .filter(coupon -> coupon.getTenantId().equals(tenantId))
            .filter(coupon -> coupon.getCode().equals(code))
            .filter(Coupon::isActive)
            .findFirst();
    }

    @Override
    public synchronized boolean existsByTenantIdAndCode(String tenantId, String code) {
        return storage.values().stream()
            .anyMatch(coupon -> coupon.getTenantId().equals(tenantId) && coupon.getCode().equals(code));
    }

    @Override
    public synchronized List<Coupon> findByTenantId(String tenantId, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            coupon -> coupon.getTenantId().equals(tenantId), pageable);
    }

    @Override
    public synchronized List<Coupon> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable) {
        return InMemoryDocuments.page(new ArrayList<>(storage.values()),
            coupon -> coupon.getTenantId().equals(tenantId) && coupon.isActive() == active, pageable);
    }

    @Override
    public synchronized Coupon save(Coupon coupon) {
        String id = InMemoryDocuments.prepareForSave(coupon);
        storage.put(id, coupon);
        return coupon;
    }

    @Override
    public synchronized long incrementTimesRedeemed(String id) {
        Coupon coupon = storage.get(id);
        if (coupon == null) {
            return 0;
        }
        coupon.redeem();
        InMemoryDocuments.prepareForSave(coupon);
        return 1;
    }
}
