package io.budgetmart.ecommerce.presentation.api.customer;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.budgetmart.ecommerce.application.customer.dto.CreateCustomerRequest;
import io.budgetmart.ecommerce.domain.tenant.Tenant;
import io.budgetmart.ecommerce.domain.tenant.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "inmemory"})
class CustomerControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TenantRepository tenantRepository;

    private String tenantId;

    @BeforeEach
    void setUp() {
        tenantId = tenantRepository.save(Tenant.create("Customer Shop", null, null, null)).getId();
    }

    @Test
    @DisplayName("POST /api/customers - 생성 후 이름 검색 (대소문자 무시)")
    void createCustomer_검색() throws Exception {
        // Given
        create("Kim Minsu", "minsu@shop.com");
        create("Park Jiyeon", "jiyeon@mail.com");

        // When & Then
        mockMvc.perform(get("/api/customers").param("tenant_id", tenantId).param("q", "KIM"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].name").value("Kim Minsu"));

        mockMvc.perform(get("/api/customers").param("tenant_id", tenantId))
            .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    @DisplayName("POST /api/customers - 이메일 형식 오류 400")
    void createCustomer_이메일형식오류() throws Exception {
        mockMvc.perform(post("/api/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new CreateCustomerRequest(tenantId, "Kim", "not-email"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.email").exists());
    }

    private void create(String name, String email) throws Exception {
        mockMvc.perform(post("/api/customers")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new CreateCustomerRequest(tenantId, name, email))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").exists());
    }
}
