package io.budgetmart.ecommerce.application.usecase.order;

import io.budgetmart.ecommerce.application.order.dto.CreateOrderRequest;
import io.budgetmart.ecommerce.application.order.dto.CreateOrderResponse;
import io.budgetmart.ecommerce.application.order.dto.OrderItemRequest;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.DocumentIds;
import io.budgetmart.ecommerce.domain.common.Money;
import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
import io.budgetmart.ecommerce.domain.order.Order;
import io.budgetmart.ecommerce.domain.order.OrderCreatedEvent;
import io.budgetmart.ecommerce.domain.order.OrderItem;
import io.budgetmart.ecommerce.domain.order.OrderRepository;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import io.budgetmart.ecommerce.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 주문 생성 UseCase
 * <p>
 * 처리 순서:
 * 1. 검증 (테넌트, 고객, 상품, 재고, 쿠폰) - 이 단계에서는 아무것도 쓰지 않는다
 * 2. 금액 계산: total = max(0, subtotal - discount), 모두 소수점 둘째 자리 반올림
 * 3. 주문 저장 (PENDING)
 * 4. 재고 확보: 항목별 조건부 차감 (stock >= quantity 일 때만 $inc)
 * 5. 쿠폰 사용 횟수 +1
 * 6. order.created 이벤트 발행 (웹훅 전달은 비동기)
 * <p>
 * 동시성 제어: 락 없음
 * - 1단계 재고 확인과 4단계 차감 사이에 다른 주문이 재고를 가져갈 수 있다
 * - 조건부 차감이 실패하면 이미 차감한 항목을 되돌리고 주문을 CANCELLED로 바꾼 뒤 INSUFFICIENT_STOCK
 * - 재고는 어떤 경우에도 음수가 되지 않는다
 * <p>
 * 트랜잭션 없음 (단일 노드 MongoDB는 다중 문서 트랜잭션을 지원하지 않는다).
 * 3단계 직후 프로세스가 죽으면 재고가 확보되지 않은 PENDING 주문이 남는다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateOrderUseCase {

    private final TenantRepository tenantRepository;
    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final CouponRepository couponRepository;
    private final OrderRepository orderRepository;
    private final MetricsCollector metricsCollector;
    private final ApplicationEventPublisher eventPublisher;

    public CreateOrderResponse execute(CreateOrderRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Creating order for tenantId: {}, items: {}, coupon: {}",
            request.tenantId(), request.items() == null ? 0 : request.items().size(), request.couponCode());

        try {
            // 1. 검증 및 금액 계산
            OrderDraft draft = prepare(request);

            // 2. 주문 저장
            Order order = orderRepository.save(Order.create(
                request.tenantId(),
                draft.customerId(),
                draft.customerName(),
                draft.customerEmail(),
                draft.items(),
                draft.subtotal(),
                draft.discount(),
                draft.total(),
                draft.coupon() == null ? null : draft.coupon().getCode()
            ));

            // 3. 재고 확보 (실패 시 보상)
            reserveStock(order);

            // 4. 쿠폰 사용 처리
            if (draft.coupon() != null) {
                couponRepository.incrementTimesRedeemed(draft.coupon().getId());
                metricsCollector.recordCouponRedemption();
            }

            // 5. 이벤트 발행 (웹훅)
            eventPublisher.publishEvent(new OrderCreatedEvent(
                order.getTenantId(),
                order.getId(),
                order.getTotal(),
                order.getCouponCode()
            ));

            metricsCollector.recordOrderSuccess();
            metricsCollector.recordOrderDuration(startTime);
            log.info("Order created successfully. orderId: {}, subtotal: {}, discount: {}, total: {}",
                order.getId(), order.getSubtotal(), order.getDiscount(), order.getTotal());
            return CreateOrderResponse.from(order);

        } catch (BusinessException e) {
            metricsCollector.recordOrderFailure();
            if (e.getErrorCode() == ErrorCode.INSUFFICIENT_STOCK) {
                metricsCollector.recordStockError();
            }
            throw e;
        }
    }

    /**
     * 주문 저장 전 검증. 하나라도 실패하면 어떤 문서도 변경되지 않는다.
     */
    private OrderDraft prepare(CreateOrderRequest request) {
        // 1. 테넌트
        tenantRepository.verifyExists(request.tenantId());

        // 2. 고객 (선택) - 이름/이메일이 비어 있으면 고객 정보로 채운다
        String customerName = request.customerName();
        String customerEmail = request.customerEmail();
        if (request.customerId() != null && !request.customerId().isBlank()) {
            DocumentIds.validate(request.customerId());
            Customer customer = customerRepository.findByIdAndTenantIdOrThrow(request.customerId(), request.tenantId());
            customerName = customerName == null ? customer.getName() : customerName;
            customerEmail = customerEmail == null ? customer.getEmail() : customerEmail;
        }

        if (request.items() == null || request.items().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 상품은 최소 1개 이상이어야 합니다");
        }

        // 3. 상품/재고 - 같은 상품이 여러 줄이면 수량을 합산해 비교
        Map<String, Product> products = new HashMap<>();
        // 줄마다 int 범위라도 합계는 넘칠 수 있으므로 long으로 누적
        Map<String, Long> requestedQuantities = new HashMap<>();
        List<OrderItem> items = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;

        for (OrderItemRequest itemRequest : request.items()) {
            if (itemRequest == null) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 항목이 비어 있습니다");
            }
            String productId = itemRequest.productId();
            int quantity = itemRequest.quantityOrDefault();
            if (productId == null || productId.isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 항목의 상품 ID는 필수입니다");
            }
            if (quantity <= 0) {
                throw new BusinessException(
                    ErrorCode.INVALID_QUANTITY,
                    "수량은 1 이상이어야 합니다. productId: " + productId + ", quantity: " + quantity
                );
            }
            DocumentIds.validate(productId);

            Product product = products.get(productId);
            if (product == null) {
                product = productRepository.findByIdAndTenantIdOrThrow(productId, request.tenantId());
                products.put(productId, product);
            }

            long requested = requestedQuantities.merge(productId, (long) quantity, Long::sum);
            if (!product.hasEnoughStock(requested)) {
                log.warn("Insufficient stock. productId: {}, requested: {}, stock: {}",
                    productId, requested, product.getStock());
                throw new BusinessException(
                    ErrorCode.INSUFFICIENT_STOCK,
                    String.format("재고가 부족합니다. 상품: %s, 요청: %d, 재고: %d",
                        product.getTitle(), requested, product.getStock())
                );
            }

            OrderItem item = OrderItem.snapshot(product, quantity);
            items.add(item);
            subtotal = subtotal.add(item.getLineTotal());
        }

        // 4. 쿠폰 (선택)
        Coupon coupon = null;
        BigDecimal discount = BigDecimal.ZERO;
        if (request.couponCode() != null && !request.couponCode().isBlank()) {
            coupon = couponRepository.findActiveByCodeOrThrow(request.tenantId(), request.couponCode());
            discount = coupon.calculateDiscount(subtotal);
        }

        // 5. 금액 - 반올림한 subtotal/discount로 total을 구해 응답 값끼리 맞아떨어지게 한다
        BigDecimal roundedSubtotal = Money.round(subtotal);
        BigDecimal roundedDiscount = Money.round(discount);
        BigDecimal total = roundedSubtotal.subtract(roundedDiscount).max(Money.zero());

        return new OrderDraft(
            request.customerId(),
            customerName,
            customerEmail,
            items,
            roundedSubtotal,
            roundedDiscount,
            total,
            coupon
        );
    }

    /**
     * 항목 순서대로 조건부 차감. 하나라도 실패하면 앞서 차감한 수량을 복구하고 주문을 취소한다.
     */
    private void reserveStock(Order order) {
        List<OrderItem> reserved = new ArrayList<>();
        for (OrderItem item : order.getItems()) {
            if (productRepository.decreaseStockIfAvailable(item.getProductId(), item.getQuantity())) {
                reserved.add(item);
                continue;
            }

            log.warn("Stock reservation lost a race. orderId: {}, productId: {}, quantity: {}",
                order.getId(), item.getProductId(), item.getQuantity());
            compensate(order, reserved);
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. 상품: %s, 요청: %d", item.getTitle(), item.getQuantity())
            );
        }
    }

    private void compensate(Order order, List<OrderItem> reserved) {
        for (OrderItem item : reserved) {
            productRepository.restoreStock(item.getProductId(), item.getQuantity());
        }
        order.cancel();
        orderRepository.save(order);
        metricsCollector.recordStockCompensation();
        log.info("Order cancelled by compensation. orderId: {}, restoredItems: {}", order.getId(), reserved.size());
    }

    private record OrderDraft(
        String customerId,
        String customerName,
        String customerEmail,
        List<OrderItem> items,
        BigDecimal subtotal,
        BigDecimal discount,
        BigDecimal total,
        Coupon coupon
    ) {
    }
}
