package io.budgetmart.ecommerce.domain.customer;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "customer")
@CompoundIndex(name = "idx_customer_tenant_email", def = "{'tenant_id': 1, 'email': 1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Customer extends BaseTimeDocument {

    @Id
    private String id;

    private String tenantId;

    private String name;

    private String email;

    public static Customer create(String tenantId, String name, String email) {
        if (name == null || name.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "고객 이름은 필수입니다");
        }
        if (email == null || email.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "고객 이메일은 필수입니다");
        }

        Customer customer = new Customer();
        customer.tenantId = tenantId;
        customer.name = name;
        customer.email = email;
        return customer;
    }
}
