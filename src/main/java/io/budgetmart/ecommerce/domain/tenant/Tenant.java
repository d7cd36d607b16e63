package io.budgetmart.ecommerce.domain.tenant;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Tenant Document
 *
 * 하나의 스토어프론트(사업자). 다른 모든 문서는 tenant_id로 이 문서를 참조한다.
 */
@Document(collection = "tenant")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Tenant extends BaseTimeDocument {

    public static final String DEFAULT_PLAN = "free";

    @Id
    private String id;

    private String name;

    @Indexed
    private String domain;

    private String plan;

    private String contactEmail;

    public static Tenant create(String name, String domain, String plan, String contactEmail) {
        validateName(name);

        Tenant tenant = new Tenant();
        tenant.name = name;
        tenant.domain = domain;
        tenant.plan = (plan == null || plan.isBlank()) ? DEFAULT_PLAN : plan;
        tenant.contactEmail = contactEmail;
        return tenant;
    }

    private static void validateName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "테넌트 이름은 필수입니다");
        }
    }
}
