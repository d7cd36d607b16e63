package io.budgetmart.ecommerce.presentation.api.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.budgetmart.ecommerce.application.tenant.dto.CreateTenantRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "inmemory"})
class TenantControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST /api/tenants - 생성 후 목록에 snake_case로 노출, plan 기본값 free")
    void createTenant_성공() throws Exception {
        // Given
        String name = "Shop-" + UUID.randomUUID().toString().substring(0, 8);
        CreateTenantRequest request = new CreateTenantRequest(name, null, null, "owner@shop.com");

        // When
        MvcResult result = mockMvc.perform(post("/api/tenants")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andDo(print())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id", matchesPattern("[0-9a-f]{24}")))
            .andReturn();
        String tenantId = objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asText();

        // Then
        mockMvc.perform(get("/api/tenants").param("limit", "1000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.id == '" + tenantId + "')].name").value(name))
            .andExpect(jsonPath("$[?(@.id == '" + tenantId + "')].plan").value("free"))
            .andExpect(jsonPath("$[?(@.id == '" + tenantId + "')].contact_email").value("owner@shop.com"));
    }

    @Test
    @DisplayName("POST /api/tenants - name 누락 시 400")
    void createTenant_이름누락() throws Exception {
        mockMvc.perform(post("/api/tenants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domain\":\"shop.example.com\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"))
            .andExpect(jsonPath("$.details.name").exists());
    }

    @Test
    @DisplayName("GET /api/tenants?limit=0 - 400")
    void getTenants_limit0() throws Exception {
        mockMvc.perform(get("/api/tenants").param("limit", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("잘못된 JSON 본문 - 400")
    void createTenant_잘못된JSON() throws Exception {
        mockMvc.perform(post("/api/tenants")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest());
    }
}
