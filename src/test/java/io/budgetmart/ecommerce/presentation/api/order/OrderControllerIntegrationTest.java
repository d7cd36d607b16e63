package io.budgetmart.ecommerce.presentation.api.order;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.budgetmart.ecommerce.application.order.dto.CreateOrderRequest;
import io.budgetmart.ecommerce.application.order.dto.OrderItemRequest;
import io.budgetmart.ecommerce.domain.coupon.Coupon;
import io.budgetmart.ecommerce.domain.coupon.CouponRepository;
import io.budgetmart.ecommerce.domain.customer.Customer;
import io.budgetmart.ecommerce.domain.customer.CustomerRepository;
import io.budgetmart.ecommerce.domain.order.OrderRepository;
import io.budgetmart.ecommerce.domain.product.Product;
import io.budgetmart.ecommerce.domain.product.ProductRepository;
import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "inmemory"})
class OrderControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TenantRepository tenantRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerRepository customerRepository;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private OrderRepository orderRepository;

    private String tenantId;
    private String shirtId;
    private String mugId;

    @BeforeEach
    void setUp() {
        // 테스트마다 새 테넌트를 만들어 데이터 격리
        tenantId = tenantRepository.save(Tenant.create("Order Shop", null, null, null)).getId();
        shirtId = productRepository.save(
            Product.create(tenantId, "Blue Shirt", null, new BigDecimal("25.00"), null, 5, "apparel", true)).getId();
        mugId = productRepository.save(
            Product.create(tenantId, "Mug", null, new BigDecimal("12.50"), null, 1, "kitchen", true)).getId();
    }

    @Test
    @DisplayName("POST /api/orders - 쿠폰 적용 주문 생성 후 목록 조회")
    void createOrder_쿠폰적용() throws Exception {
        // Given
        couponRepository.save(Coupon.create(tenantId, "SAVE10", new BigDecimal("10"), null, true, null));
        CreateOrderRequest request = new CreateOrderRequest(tenantId,
            List.of(new OrderItemRequest(shirtId, 1), new OrderItemRequest(mugId, 1)),
            null, "Kim", "kim@shop.com", "SAVE10");

        // When & Then
        mockMvc.perform(post("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andDo(print())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.subtotal").value(37.5))
            .andExpect(jsonPath("$.discount").value(3.75))
            .andExpect(jsonPath("$.total").value(33.75));

        mockMvc.perform(get("/api/orders").param("tenant_id", tenantId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].status").value("pending"))
            .andExpect(jsonPath("$[0].coupon_code").value("SAVE10"))
            .andExpect(jsonPath("$[0].customer_name").value("Kim"))
            .andExpect(jsonPath("$[0].items[0].product_id").value(shirtId))
            .andExpect(jsonPath("$[0].items[0].title").value("Blue Shirt"));

        assertThat(productRepository.findByIdAndTenantIdOrThrow(mugId, tenantId).getStock()).isZero();
    }

    @Test
    @DisplayName("POST /api/orders - 고객 ID로 이름/이메일 채움")
    void createOrder_고객정보채움() throws Exception {
        // Given
        String customerId = customerRepository.save(Customer.create(tenantId, "Lee", "lee@shop.com")).getId();
        CreateOrderRequest request = new CreateOrderRequest(tenantId,
            List.of(new OrderItemRequest(shirtId, null)), customerId, null, null, null);

        // When
        mockMvc.perform(post("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(25.0));

        // Then
        mockMvc.perform(get("/api/orders").param("tenant_id", tenantId))
            .andExpect(jsonPath("$[0].customer_email").value("lee@shop.com"))
            .andExpect(jsonPath("$[0].items[0].quantity").value(1));
    }

    @Test
    @DisplayName("POST /api/orders - 재고 부족 시 400, 재고와 주문 모두 그대로")
    void createOrder_재고부족() throws Exception {
        // Given
        CreateOrderRequest request = new CreateOrderRequest(tenantId,
            List.of(new OrderItemRequest(shirtId, 1), new OrderItemRequest(mugId, 2)),
            null, null, null, null);

        // When & Then
        mockMvc.perform(post("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("P002"));

        assertThat(productRepository.findByIdAndTenantIdOrThrow(shirtId, tenantId).getStock()).isEqualTo(5);
        mockMvc.perform(get("/api/orders").param("tenant_id", tenantId))
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("POST /api/orders - 없는 쿠폰 400, 없는 상품 404, 수량 0은 400")
    void createOrder_검증실패() throws Exception {
        perform(new CreateOrderRequest(tenantId, List.of(new OrderItemRequest(shirtId, 1)), null, null, null, "NOPE"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("C002"));

        perform(new CreateOrderRequest(tenantId, List.of(new OrderItemRequest("665f1c2e9b1d8a3f4c2e1aff", 1)),
                null, null, null, null))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("P001"));

        perform(new CreateOrderRequest(tenantId, List.of(new OrderItemRequest(shirtId, 0)), null, null, null, null))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("O001"));
    }

    @Test
    @DisplayName("POST /api/orders - 빈 items는 400, 존재하지 않는 테넌트는 404")
    void createOrder_요청오류() throws Exception {
        perform(new CreateOrderRequest(tenantId, List.of(), null, null, null, null))
            .andExpect(status().isBadRequest());

        perform(new CreateOrderRequest("665f1c2e9b1d8a3f4c2e1aff", List.of(new OrderItemRequest(shirtId, 1)),
                null, null, null, null))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("T001"));
    }

    @Test
    @DisplayName("POST /api/orders - null 항목은 500이 아닌 400 COMMON002")
    void createOrder_null항목() throws Exception {
        // Given
        String body = "{\"tenant_id\":\"" + tenantId + "\",\"items\":[null]}";

        // When & Then
        mockMvc.perform(post("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"));

        mockMvc.perform(get("/api/orders").param("tenant_id", tenantId))
            .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("POST /api/orders - 같은 상품 수량 합계가 int 범위를 넘으면 400, 취소 주문도 남지 않는다")
    void createOrder_수량합계오버플로() throws Exception {
        // Given - Blue Shirt 재고 5
        CreateOrderRequest request = new CreateOrderRequest(tenantId,
            List.of(new OrderItemRequest(shirtId, 10), new OrderItemRequest(shirtId, Integer.MAX_VALUE)),
            null, null, null, null);

        // When & Then
        perform(request)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("P002"));

        assertThat(orderRepository.findByTenantId(tenantId, PageRequest.of(0, 100))).isEmpty();
        assertThat(productRepository.findByIdAndTenantIdOrThrow(shirtId, tenantId).getStock()).isEqualTo(5);
    }

    private ResultActions perform(CreateOrderRequest request) throws Exception {
        return mockMvc.perform(post("/api/orders")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(request)));
    }
}
