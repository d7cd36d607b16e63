package io.budgetmart.ecommerce.domain.order;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.product.Product;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.data.mongodb.core.mapping.FieldType;

import java.math.BigDecimal;

/**
 * 주문 항목 (Order 문서에 내장)
 *
 * price/title은 주문 시점의 스냅샷이다. 이후 상품 가격이 바뀌어도 변하지 않는다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    private String productId;

    private int quantity;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal price;

    private String title;

    public static OrderItem snapshot(Product product, int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }

        OrderItem item = new OrderItem();
        item.productId = product.getId();
        item.quantity = quantity;
        item.price = product.getPrice();
        item.title = product.getTitle();
        return item;
    }

    public BigDecimal getLineTotal() {
        return price.multiply(BigDecimal.valueOf(quantity));
    }
}
