package io.budgetmart.ecommerce.infrastructure.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.config.AuthProperties;
import io.budgetmart.ecommerce.domain.admin.AdminClaims;
import io.budgetmart.ecommerce.domain.admin.AdminRole;
import io.budgetmart.ecommerce.domain.admin.AdminTokenProvider;
import io.budgetmart.ecommerce.domain.admin.AdminUser;
import io.budgetmart.ecommerce.domain.admin.IssuedAdminToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * HMAC-SHA256 서명 JWT 기반 관리자 토큰
 * <p>
 * 클레임: sub(email), tenant_id, role, iat, exp
 * 서명 키는 budgetmart.auth.token-secret (32바이트 이상).
 */
@Slf4j
@Component
public class SignedAdminTokenProvider implements AdminTokenProvider {

    private static final String CLAIM_TENANT_ID = "tenant_id";
    private static final String CLAIM_ROLE = "role";

    private final AuthProperties authProperties;
    private final Clock clock;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    public SignedAdminTokenProvider(AuthProperties authProperties, Clock clock) {
        this.authProperties = authProperties;
        this.clock = clock;
        byte[] secret = authProperties.tokenSecret().getBytes(StandardCharsets.UTF_8);
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new IllegalStateException("budgetmart.auth.token-secret must be at least 32 bytes", e);
        }
    }

    @Override
    public IssuedAdminToken issue(AdminUser adminUser) {
        // exp 클레임은 초 단위
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(authProperties.tokenTtl());
        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .issuer(authProperties.issuer())
                .subject(adminUser.getEmail())
                .claim(CLAIM_TENANT_ID, adminUser.getTenantId())
                .claim(CLAIM_ROLE, adminUser.getRole().code())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .build();

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claimsSet);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "토큰 서명에 실패했습니다", e);
        }
        AdminClaims claims = new AdminClaims(adminUser.getTenantId(), adminUser.getEmail(), adminUser.getRole(), expiresAt);
        return new IssuedAdminToken(jwt.serialize(), claims);
    }

    @Override
    public AdminClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "토큰이 없습니다");
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!jwt.verify(verifier)) {
                throw new BusinessException(ErrorCode.UNAUTHORIZED, "토큰 서명이 올바르지 않습니다");
            }

            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            Date expiresAt = claims.getExpirationTime();
            if (expiresAt == null || !expiresAt.toInstant().isAfter(clock.instant())) {
                throw new BusinessException(ErrorCode.UNAUTHORIZED, "만료된 토큰입니다");
            }

            return new AdminClaims(
                    claims.getStringClaim(CLAIM_TENANT_ID),
                    claims.getSubject(),
                    AdminRole.from(claims.getStringClaim(CLAIM_ROLE)),
                    expiresAt.toInstant()
            );
        } catch (ParseException | JOSEException e) {
            log.warn("Rejected malformed admin token: {}", e.getMessage());
            throw new BusinessException(ErrorCode.UNAUTHORIZED, "잘못된 토큰입니다", e);
        }
    }
}
