package io.budgetmart.ecommerce.application.system.dto;

import java.util.List;

/**
 * /schema 응답의 컬렉션 단위 항목
 */
public record CollectionSchema(
    List<String> fields,
    List<String> indexes
) {
    public static CollectionSchema of(List<String> fields, List<String> indexes) {
        return new CollectionSchema(fields, indexes);
    }
}
