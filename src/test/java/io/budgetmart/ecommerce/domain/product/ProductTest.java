package io.budgetmart.ecommerce.domain.product;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class ProductTest {

    private static final String TENANT_ID = "665f1c2e9b1d8a3f4c2e1a01";

    @Test
    @DisplayName("상품 생성 - 재고/활성 여부 기본값")
    void create_기본값() {
        // When
        Product product = Product.create(TENANT_ID, "Blue Shirt", null, new BigDecimal("19.99"), null, null, null, null);

        // Then
        assertThat(product.getStock()).isZero();
        assertThat(product.isActive()).isTrue();
        assertThat(product.getTenantId()).isEqualTo(TENANT_ID);
    }

    @Test
    @DisplayName("상품 생성 실패 - 음수 가격")
    void create_음수가격_예외발생() {
        assertThatThrownBy(() -> Product.create(TENANT_ID, "Blue Shirt", null, new BigDecimal("-1"), null, 1, null, true))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("상품 생성 실패 - 상품명 누락")
    void create_상품명누락_예외발생() {
        assertThatThrownBy(() -> Product.create(TENANT_ID, " ", null, BigDecimal.TEN, null, 1, null, true))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("재고 차감 성공")
    void decreaseStock_성공() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", "Ceramic mug", new BigDecimal("7.50"), null, 10, "kitchen", true);

        // When
        product.decreaseStock(3);

        // Then
        assertThat(product.getStock()).isEqualTo(7);
    }

    @Test
    @DisplayName("재고 차감 실패 - 재고 부족, 메시지에 상품명 포함")
    void decreaseStock_재고부족_예외발생() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", "Ceramic mug", new BigDecimal("7.50"), null, 5, "kitchen", true);

        // When & Then
        assertThatThrownBy(() -> product.decreaseStock(10))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_STOCK)
            .hasMessageContaining("Mug");

        // 재고는 변경되지 않음
        assertThat(product.getStock()).isEqualTo(5);
    }

    @Test
    @DisplayName("재고 차감 실패 - 수량이 0")
    void decreaseStock_수량0_예외발생() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", null, new BigDecimal("7.50"), null, 10, null, true);

        // When & Then
        assertThatThrownBy(() -> product.decreaseStock(0))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_QUANTITY);
    }

    @Test
    @DisplayName("재고 조정 - 음수 delta는 차감, 양수 delta는 입고")
    void adjustStock_증감() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", null, new BigDecimal("7.50"), null, 10, null, true);

        // When
        product.adjustStock(-4);
        product.adjustStock(6);
        product.adjustStock(0);

        // Then
        assertThat(product.getStock()).isEqualTo(12);
    }

    @Test
    @DisplayName("재고 조정 실패 - 재고보다 큰 차감은 거절")
    void adjustStock_초과차감_예외발생() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", null, new BigDecimal("7.50"), null, 2, null, true);

        // When & Then
        assertThatThrownBy(() -> product.adjustStock(-3))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_STOCK);
        assertThat(product.getStock()).isEqualTo(2);
    }

    @Test
    @DisplayName("재고 입고 실패 - 결과가 int 최대치를 넘으면 거절")
    void increaseStock_최대치초과_예외발생() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", null, new BigDecimal("7.50"), null, 10, null, true);

        // When & Then
        assertThatThrownBy(() -> product.increaseStock(Integer.MAX_VALUE))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_INPUT);
        assertThat(product.getStock()).isEqualTo(10);
    }

    @Test
    @DisplayName("재고 조정 실패 - Integer.MIN_VALUE 차감은 재고 부족")
    void adjustStock_최소값_예외발생() {
        // Given
        Product product = Product.create(TENANT_ID, "Mug", null, new BigDecimal("7.50"), null, 10, null, true);

        // When & Then
        assertThatThrownBy(() -> product.adjustStock(Integer.MIN_VALUE))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INSUFFICIENT_STOCK);
        assertThat(product.getStock()).isEqualTo(10);
    }
}
