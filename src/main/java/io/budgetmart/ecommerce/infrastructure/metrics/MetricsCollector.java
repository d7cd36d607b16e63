package io.budgetmart.ecommerce.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 주요 비즈니스 메트릭을 수집하는 컴포넌트
 *
 * 수집 메트릭:
 * - orders_total: 주문 성공/실패 카운터
 * - order_duration_seconds: 주문 처리 시간 (P50, P95, P99)
 * - stock_errors_total: 재고 부족 에러 카운터
 * - stock_compensations_total: 재고 확보 경쟁에서 져서 보상 처리된 주문 수
 * - coupon_redemptions_total: 쿠폰 사용 카운터
 * - webhook_deliveries_total: 웹훅 전달 성공/실패 카운터
 * - webhook_rejections_total: executor 포화로 버려진 웹훅 전달 수
 */
@Component
public class MetricsCollector {

    // 주문 관련 메트릭
    private final Counter orderSuccessCounter;
    private final Counter orderFailureCounter;
    private final Timer orderDurationTimer;

    // 재고 관련 메트릭
    private final Counter stockErrorCounter;
    private final Counter stockCompensationCounter;

    // 쿠폰 관련 메트릭
    private final Counter couponRedemptionCounter;

    // 웹훅 관련 메트릭
    private final Counter webhookSuccessCounter;
    private final Counter webhookFailureCounter;
    private final Counter webhookRejectionCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.orderSuccessCounter = Counter.builder("orders_total")
                .tag("status", "success")
                .description("Total number of successful orders")
                .register(meterRegistry);

        this.orderFailureCounter = Counter.builder("orders_total")
                .tag("status", "failure")
                .description("Total number of failed orders")
                .register(meterRegistry);

        this.orderDurationTimer = Timer.builder("order_duration_seconds")
                .description("Order processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)  // P50, P95, P99
                .register(meterRegistry);

        this.stockErrorCounter = Counter.builder("stock_errors_total")
                .description("Total number of stock shortage errors")
                .register(meterRegistry);

        this.stockCompensationCounter = Counter.builder("stock_compensations_total")
                .description("Orders cancelled because a stock reservation lost a race")
                .register(meterRegistry);

        this.couponRedemptionCounter = Counter.builder("coupon_redemptions_total")
                .description("Total number of coupon redemptions")
                .register(meterRegistry);

        this.webhookSuccessCounter = Counter.builder("webhook_deliveries_total")
                .tag("status", "success")
                .description("Total number of delivered webhooks")
                .register(meterRegistry);

        this.webhookFailureCounter = Counter.builder("webhook_deliveries_total")
                .tag("status", "failure")
                .description("Total number of failed webhook deliveries")
                .register(meterRegistry);

        this.webhookRejectionCounter = Counter.builder("webhook_rejections_total")
                .description("Webhook deliveries dropped because the executor was saturated")
                .register(meterRegistry);
    }

    // ============================================================
    // 주문 관련 메트릭
    // ============================================================

    public void recordOrderSuccess() {
        orderSuccessCounter.increment();
    }

    public void recordOrderFailure() {
        orderFailureCounter.increment();
    }

    public void recordOrderDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        orderDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    // ============================================================
    // 재고 관련 메트릭
    // ============================================================

    public void recordStockError() {
        stockErrorCounter.increment();
    }

    public void recordStockCompensation() {
        stockCompensationCounter.increment();
    }

    // ============================================================
    // 쿠폰 / 웹훅 관련 메트릭
    // ============================================================

    public void recordCouponRedemption() {
        couponRedemptionCounter.increment();
    }

    public void recordWebhookSuccess() {
        webhookSuccessCounter.increment();
    }

    public void recordWebhookFailure() {
        webhookFailureCounter.increment();
    }

    public void recordWebhookRejection() {
        webhookRejectionCounter.increment();
    }
}
