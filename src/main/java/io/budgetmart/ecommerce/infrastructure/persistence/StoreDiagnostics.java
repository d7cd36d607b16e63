package io.budgetmart.ecommerce.infrastructure.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.env.Environment;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /test 진단 정보
 * <p>
 * 저장소 연결 상태를 점검해 그대로 보고한다. 점검 실패는 예외가 아니라 응답 본문에 담긴다.
 * inmemory 프로필에서는 MongoTemplate이 없으므로 "Not Available"을 보고한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreDiagnostics {

    private static final int MAX_COLLECTIONS = 10;
    private static final int MAX_ERROR_LENGTH = 80;

    private final ObjectProvider<MongoTemplate> mongoTemplateProvider;
    private final Environment environment;

    public Map<String, Object> inspect() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("backend", "Running");
        response.put("database", "Not Available");
        response.put("database_url", null);
        response.put("database_name", null);
        response.put("connection_status", "Not Connected");
        response.put("collections", List.of());

        MongoTemplate mongoTemplate = mongoTemplateProvider.getIfAvailable();
        if (mongoTemplate == null) {
            return response;
        }

        try {
            response.put("database", "Connected & Working");
            response.put("database_url", environment.containsProperty("DATABASE_URL") ? "Set" : "Not Set");
            response.put("database_name", mongoTemplate.getDb().getName());
            response.put("connection_status", "Connected");
            try {
                List<String> collections = new ArrayList<>(mongoTemplate.getCollectionNames());
                response.put("collections", collections.subList(0, Math.min(MAX_COLLECTIONS, collections.size())));
            } catch (RuntimeException e) {
                log.warn("Failed to list collections", e);
                response.put("database", "Connected but Error: " + truncate(e.getMessage()));
            }
        } catch (RuntimeException e) {
            log.warn("Database diagnostics failed", e);
            response.put("database", "Error: " + truncate(e.getMessage()));
        }
        return response;
    }

    private String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
