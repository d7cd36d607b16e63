package io.budgetmart.ecommerce.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI: /swagger-ui.html, 문서: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    public static final String ADMIN_TOKEN_SCHEME = "adminToken";

    @Bean
    public OpenAPI budgetMartOpenApi() {
        return new OpenAPI()
            .info(new Info()
                .title("DailyBudgetMart API")
                .description("테넌트별 상품, 고객, 쿠폰, 주문, 웹훅, 테마 관리 API. 모든 JSON 필드는 snake_case.")
                .version("0.1.0"))
            .components(new Components()
                .addSecuritySchemes(ADMIN_TOKEN_SCHEME, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("bearer")
                    .bearerFormat("JWT")
                    .description("POST /api/admin/login 으로 발급받은 토큰")));
    }
}
