package io.budgetmart.ecommerce.domain.order;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order Document
 *
 * total = max(0, subtotal - discount), 소수점 둘째 자리 반올림.
 * items는 저장 이후 변경되지 않는다. 상태(status)만 바뀔 수 있다.
 */
@Document(collection = "order")
@CompoundIndex(name = "idx_order_tenant_status", def = "{'tenant_id': 1, 'status': 1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeDocument {

    @Id
    private String id;

    private String tenantId;

    private String customerId;

    private String customerName;

    private String customerEmail;

    private List<OrderItem> items = new ArrayList<>();

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal subtotal;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal discount;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal total;

    private String couponCode;

    private OrderStatus status;

    public static Order create(String tenantId, String customerId, String customerName, String customerEmail,
                               List<OrderItem> items, BigDecimal subtotal, BigDecimal discount,
                               BigDecimal total, String couponCode) {
        if (items == null || items.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 상품은 최소 1개 이상이어야 합니다");
        }
        if (total == null || total.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "주문 금액은 0 이상이어야 합니다");
        }

        Order order = new Order();
        order.tenantId = tenantId;
        order.customerId = customerId;
        order.customerName = customerName;
        order.customerEmail = customerEmail;
        order.items = new ArrayList<>(items);
        order.subtotal = subtotal;
        order.discount = discount;
        order.total = total;
        order.couponCode = couponCode;
        order.status = OrderStatus.PENDING;
        return order;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public void cancel() {
        if (this.status != OrderStatus.PENDING) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "대기 상태의 주문만 취소할 수 있습니다. status: " + status
            );
        }
        this.status = OrderStatus.CANCELLED;
    }
}
