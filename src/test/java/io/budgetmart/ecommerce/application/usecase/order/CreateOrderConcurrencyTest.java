package io.budgetmart.ecommerce.application.usecase.order;

import io.budgetmart.ecommerce.application.order.dto.CreateOrderRequest;
import io.budgetmart.ecommerce.application.order.dto.OrderItemRequest;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.order.Order;
import io.budgetmart.ecommerce.domain.order.OrderStatus;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.infrastructure.metrics.MetricsCollector;
import io.budgetmart.ecommerce.infrastructure.persistence.coupon.InMemoryCouponRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.customer.InMemoryCustomerRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.order.InMemoryOrderRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.product.InMemoryProductRepository;
import io.budgetmart.ecommerce.infrastructure.persistence.tenant.InMemoryTenantRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class CreateOrderConcurrencyTest {

    @Test
    @DisplayName("마지막 재고 1개를 10개 주문이 동시에 경쟁 - 정확히 1건 성공, 재고 0, 음수 없음")
    void execute_마지막재고경쟁() throws InterruptedException {
        // Given
        InMemoryTenantRepository tenantRepository = new InMemoryTenantRepository();
        InMemoryProductRepository productRepository = new InMemoryProductRepository();
        InMemoryOrderRepository orderRepository = new InMemoryOrderRepository();
        CreateOrderUseCase createOrderUseCase = new CreateOrderUseCase(
            tenantRepository,
            new InMemoryCustomerRepository(),
            productRepository,
            new InMemoryCouponRepository(),
            orderRepository,
            new MetricsCollector(new SimpleMeterRegistry()),
            mock(org.springframework.context.ApplicationEventPublisher.class)
        );

        String tenantId = tenantRepository.save(Tenant.create("Budget Shop", null, null, null)).getId();
        String productId = productRepository.save(
            Product.create(tenantId, "Last Lamp", null, new BigDecimal("30.00"), null, 1, null, true)).getId();

        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);

        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger stockFailureCount = new AtomicInteger(0);

        // When: 10개 스레드가 동시에 주문
        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                ready.countDown();
                try {
                    start.await();
                    createOrderUseCase.execute(new CreateOrderRequest(
                        tenantId, List.of(new OrderItemRequest(productId, 1)), null, null, null, null));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode() == ErrorCode.INSUFFICIENT_STOCK) {
                        stockFailureCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        done.await(10, TimeUnit.SECONDS);
        executor.shutdown();

        // Then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(stockFailureCount.get()).isEqualTo(threadCount - 1);
        assertThat(productRepository.findById(productId).orElseThrow().getStock()).isZero();

        // 경합에서 진 주문은 남더라도 cancelled 상태
        List<Order> orders = orderRepository.findAll();
        assertThat(orders).filteredOn(order -> order.getStatus() == OrderStatus.PENDING).hasSize(1);
    }
}
