package io.budgetmart.ecommerce.domain.common;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import org.bson.types.ObjectId;

/**
 * 문서 식별자 규칙
 * <p>
 * 모든 id는 ObjectId의 24자리 hex 문자열이다.
 * 형식이 맞지 않으면 조회 전에 INVALID_INPUT(400)으로 거절한다.
 */
public final class DocumentIds {

    private DocumentIds() {
    }

    public static String newId() {
        return new ObjectId().toHexString();
    }

    public static boolean isValid(String id) {
        return id != null && ObjectId.isValid(id);
    }

    public static String validate(String id) {
        if (!isValid(id)) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                "잘못된 ID 형식입니다. id: " + id
            );
        }
        return id;
    }
}
