package io.budgetmart.ecommerce.domain.admin;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * AdminUser Document
 *
 * password_hash는 PasswordEncoder가 만든 단방향 다이제스트만 저장한다.
 */
@Document(collection = "admin_user")
@CompoundIndex(name = "uk_admin_tenant_email", def = "{'tenant_id': 1, 'email': 1}", unique = true)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AdminUser extends BaseTimeDocument {

    @Id
    private String id;

    private String tenantId;

    private String email;

    private String passwordHash;

    private AdminRole role;

    public static AdminUser create(String tenantId, String email, String passwordHash, AdminRole role) {
        if (email == null || email.trim().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "관리자 이메일은 필수입니다");
        }
        if (passwordHash == null || passwordHash.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "비밀번호는 필수입니다");
        }

        AdminUser adminUser = new AdminUser();
        adminUser.tenantId = tenantId;
        adminUser.email = email;
        adminUser.passwordHash = passwordHash;
        adminUser.role = role == null ? AdminRole.OWNER : role;
        return adminUser;
    }
}
