package io.budgetmart.ecommerce.infrastructure.persistence.coupon;

import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MongoCouponRepository extends MongoRepository<Coupon, String>, CouponRepository {

    @Override
    Optional<Coupon> findById(String id);

    @Override
    Coupon save(Coupon coupon);

    @Override
    Optional<Coupon> findByTenantIdAndCodeAndActiveTrue(String tenantId, String code);

    @Override
    boolean existsByTenantIdAndCode(String tenantId, String code);

    @Override
    List<Coupon> findByTenantId(String tenantId, Pageable pageable);

    @Override
    List<Coupon> findByTenantIdAndActive(String tenantId, boolean active, Pageable pageable);

    @Override
    @Query("{ '_id': ?0 }")
    @Update("{ '$inc': { 'times_redeemed': 1 } }")
    long incrementTimesRedeemed(String id);
}
