package io.budgetmart.ecommerce.presentation.api.system;

import io.budgetmart.ecommerce.application.system.dto.CollectionSchema;
import io.budgetmart.ecommerce.application.usecase.system.DescribeSchemaUseCase;
import io.budgetmart.ecommerce.infrastructure.persistence.StoreDiagnostics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 확인 및 도구용 엔드포인트
 *
 * - GET /        : 서비스 이름과 상태
 * - GET /test    : 저장소 연결 진단 (실패도 200 본문으로 보고)
 * - GET /schema  : 컬렉션 필드/인덱스 목록
 */
@RestController
@RequiredArgsConstructor
public class SystemController {

    static final String SERVICE_NAME = "DailyBudgetMart";

    private final StoreDiagnostics storeDiagnostics;
    private final DescribeSchemaUseCase describeSchemaUseCase;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("name", SERVICE_NAME);
        body.put("status", "ok");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> diagnostics() {
        return ResponseEntity.ok(storeDiagnostics.inspect());
    }

    @GetMapping("/schema")
    public ResponseEntity<Map<String, CollectionSchema>> schema() {
        return ResponseEntity.ok(describeSchemaUseCase.execute());
    }
}
