package io.budgetmart.ecommerce.domain.product;

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

/**
 * Product Document
 *
 * 재고(stock)는 주문 처리 후에도 음수가 되지 않는다.
 * 주문 시 차감은 저장소의 조건부 갱신(stock >= 수량)으로만 수행된다.
 */
@Document(collection = "product")
@CompoundIndex(name = "idx_product_tenant_title", def = "{'tenant_id': 1, 'title': 1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseTimeDocument {

    @Id
    private String id;

    private String tenantId;

    private String title;

    private String description;

    @Field(targetType = FieldType.DECIMAL128)
    private BigDecimal price;

    private String image;

    private int stock;

    private String category;

    @Field("is_active")
    private boolean active;

    public static Product create(String tenantId, String title, String description, BigDecimal price,
                                 String image, Integer stock, String category, Boolean active) {
        validateTitle(title);
        validatePrice(price);
        int initialStock = stock == null ? 0 : stock;
        validateStock(initialStock);

        Product product = new Product();
        product.tenantId = tenantId;
        product.title = title;
        product.description = description;
        product.price = price;
        product.image = image;
        product.stock = initialStock;
        product.category = category;
        product.active = active == null || active;
        return product;
    }

    public boolean hasEnoughStock(long quantity) {
        return this.stock >= quantity;
    }

    public void decreaseStock(int quantity) {
        validateQuantity(quantity);
        if (!hasEnoughStock(quantity)) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. 상품: %s, 요청: %d, 재고: %d", title, quantity, stock)
            );
        }
        this.stock -= quantity;
    }

    public void increaseStock(int quantity) {
        validateQuantity(quantity);
        try {
            this.stock = Math.addExact(this.stock, quantity);
        } catch (ArithmeticException e) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("재고 최대치를 초과합니다. 상품: %s, 요청: %d, 재고: %d", title, quantity, stock),
                e
            );
        }
    }

    /**
     * 관리자 재고 조정 (PATCH /stock)
     * 결과 재고가 음수가 되는 조정은 거절한다.
     */
    public void adjustStock(int delta) {
        if (delta == Integer.MIN_VALUE) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. 상품: %s, 요청: %d, 재고: %d", title, delta, stock)
            );
        }
        if (delta < 0) {
            decreaseStock(-delta);
        } else if (delta > 0) {
            increaseStock(delta);
        }
    }

    // ====================================
    // Validation Methods
    // ====================================

    private static void validateTitle(String title) {
        if (title == null || title.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품명은 필수입니다");
        }
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "가격은 0 이상이어야 합니다");
        }
    }

    private static void validateStock(int stock) {
        if (stock < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "재고는 0 이상이어야 합니다");
        }
    }

    private void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }
}
