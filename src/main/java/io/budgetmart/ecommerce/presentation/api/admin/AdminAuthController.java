package io.budgetmart.ecommerce.presentation.api.admin;

import io.budgetmart.ecommerce.application.admin.dto.AdminSessionResponse;
import io.budgetmart.ecommerce.application.admin.dto.LoginAdminRequest;
import io.budgetmart.ecommerce.application.admin.dto.LoginAdminResponse;
import io.budgetmart.ecommerce.application.admin.dto.RegisterAdminRequest;
import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.usecase.admin.GetAdminSessionUseCase;
import io.budgetmart.ecommerce.application.usecase.admin.LoginAdminUseCase;
import io.budgetmart.ecommerce.application.usecase.admin.RegisterAdminUseCase;
import io.budgetmart.ecommerce.config.OpenApiConfig;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 관리자 인증 API
 *
 * - POST /api/admin/register
 * - POST /api/admin/login  → 서명된 Bearer 토큰 발급
 * - GET  /api/admin/me     → 토큰 검증 후 세션 정보
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminAuthController {

    private final RegisterAdminUseCase registerAdminUseCase;
    private final LoginAdminUseCase loginAdminUseCase;
    private final GetAdminSessionUseCase getAdminSessionUseCase;

    @PostMapping("/register")
    public ResponseEntity<IdResponse> register(@Valid @RequestBody RegisterAdminRequest request) {
        return ResponseEntity.ok(registerAdminUseCase.execute(request));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginAdminResponse> login(@Valid @RequestBody LoginAdminRequest request) {
        return ResponseEntity.ok(loginAdminUseCase.execute(request));
    }

    @SecurityRequirement(name = OpenApiConfig.ADMIN_TOKEN_SCHEME)
    @GetMapping("/me")
    public ResponseEntity<AdminSessionResponse> me(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization) {
        return ResponseEntity.ok(getAdminSessionUseCase.execute(authorization));
    }
}
