package io.budgetmart.ecommerce.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 관리자 토큰 설정 (budgetmart.auth.*)
 *
 * @param tokenSecret HS256 서명 키, 32바이트 이상
 * @param tokenTtl    토큰 유효 기간
 * @param issuer      iss 클레임
 */
@Validated
@ConfigurationProperties(prefix = "budgetmart.auth")
public record AuthProperties(
        @NotBlank @Size(min = 32) String tokenSecret,
        @NotNull @DefaultValue("12h") Duration tokenTtl,
        @DefaultValue("budgetmart") String issuer
) {
}
