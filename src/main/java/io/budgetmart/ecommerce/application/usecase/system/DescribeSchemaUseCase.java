package io.budgetmart.ecommerce.application.usecase.system;

import io.budgetmart.ecommerce.application.system.dto.CollectionSchema;
import io.budgetmart.ecommerce.application.usecase.UseCase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /schema
 * <p>
 * 마이그레이션/관리 도구용 컬렉션 필드·인덱스 목록. 저장소를 조회하지 않는 정적 설명이다.
 * 문서 클래스의 필드나 인덱스를 바꾸면 여기도 함께 고친다.
 */
@UseCase
public class DescribeSchemaUseCase {

    private static final Map<String, CollectionSchema> SCHEMA = buildSchema();

    public Map<String, CollectionSchema> execute() {
        return SCHEMA;
    }

    private static Map<String, CollectionSchema> buildSchema() {
        Map<String, CollectionSchema> schema = new LinkedHashMap<>();
        schema.put("tenant", CollectionSchema.of(
            List.of("name", "domain", "plan", "contact_email"),
            List.of("domain")));
        schema.put("product", CollectionSchema.of(
            List.of("tenant_id", "title", "description", "price", "image", "stock", "category", "is_active"),
            List.of("tenant_id", "title")));
        schema.put("customer", CollectionSchema.of(
            List.of("tenant_id", "name", "email"),
            List.of("tenant_id", "email")));
        schema.put("order", CollectionSchema.of(
            List.of("tenant_id", "customer_id", "customer_name", "customer_email", "items",
                "subtotal", "discount", "total", "coupon_code", "status"),
            List.of("tenant_id", "status")));
        schema.put("coupon", CollectionSchema.of(
            List.of("tenant_id", "code", "percent_off", "amount_off", "active", "max_redemptions", "times_redeemed"),
            List.of("tenant_id", "code")));
        schema.put("admin_user", CollectionSchema.of(
            List.of("tenant_id", "email", "password_hash", "role"),
            List.of("tenant_id", "email")));
        schema.put("webhook", CollectionSchema.of(
            List.of("tenant_id", "url", "events", "active"),
            List.of("tenant_id")));
        schema.put("theme_settings", CollectionSchema.of(
            List.of("tenant_id", "primary_color", "hero_heading", "hero_subtext", "logo_url", "featured_categories"),
            List.of("tenant_id")));
        return Collections.unmodifiableMap(schema);
    }
}
