package io.budgetmart.ecommerce.infrastructure.persistence;

import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import io.budgetmart.ecommerce.domain.common.DocumentIds;
import org.springframework.data.domain.Pageable;

import java.lang.reflect.Field;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * inmemory 프로필 저장소 공통 처리
 * - id 발급 (ObjectId hex, MongoDB와 동일한 형식)
 * - created_at / updated_at 기록 (Mongo Auditing 대체)
 */
public final class InMemoryDocuments {

    private InMemoryDocuments() {
    }

    /**
     * 저장 직전 호출. 신규 문서면 id를 발급하고 타임스탬프를 기록한다.
     *
     * @return 문서 id
     */
    public static String prepareForSave(Object document) {
        String id = (String) readField(document, "id");
        LocalDateTime now = LocalDateTime.now();
        if (id == null) {
            id = DocumentIds.newId();
            writeField(document, document.getClass(), "id", id);
            writeField(document, BaseTimeDocument.class, "createdAt", now);
        }
        writeField(document, BaseTimeDocument.class, "updatedAt", now);
        return id;
    }

    public static <T> List<T> page(List<T> documents, Predicate<T> filter, Pageable pageable) {
        return documents.stream()
            .filter(filter)
            .limit(pageable.getPageSize())
            .collect(Collectors.toList());
    }

    public static boolean containsIgnoreCase(String value, String keyword) {
        return value != null && value.toLowerCase().contains(keyword.toLowerCase());
    }

    private static Object readField(Object target, String name) {
        try {
            Field field = target.getClass().getDeclaredField(name);
            field.setAccessible(true);
            return field.get(target);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to read field: " + name, e);
        }
    }

    private static void writeField(Object target, Class<?> owner, String name, Object value) {
        try {
            Field field = owner.getDeclaredField(name);
            field.setAccessible(true);
            field.set(target, value);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to set field: " + name, e);
        }
    }
}
