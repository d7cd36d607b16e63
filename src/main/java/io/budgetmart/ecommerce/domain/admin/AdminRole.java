package io.budgetmart.ecommerce.domain.admin;

import com.fasterxml.jackson.annotation.JsonValue;
import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;

public enum AdminRole {
    OWNER,
    STAFF;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    public static AdminRole from(String value) {
        if (value == null || value.isBlank()) {
            return OWNER;
        }
        for (AdminRole role : values()) {
            if (role.code().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new BusinessException(ErrorCode.INVALID_INPUT, "알 수 없는 관리자 역할입니다. role: " + value);
    }
}
