package io.budgetmart.ecommerce.domain.webhook;

import io.budgetmart.ecommerce.common.exception.BusinessException;
import io.budgetmart.ecommerce.common.exception.ErrorCode;
import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

@Document(collection = "webhook")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Webhook extends BaseTimeDocument {

    @Id
    private String id;

    @Indexed
    private String tenantId;

    private String url;

    private Set<String> events = new LinkedHashSet<>();

    private boolean active;

    public static Webhook create(String tenantId, String url, Set<String> events, Boolean active) {
        validateUrl(url);

        Webhook webhook = new Webhook();
        webhook.tenantId = tenantId;
        webhook.url = url;
        webhook.events = events == null ? new LinkedHashSet<>() : new LinkedHashSet<>(events);
        webhook.active = active == null || active;
        return webhook;
    }

    public Set<String> getEvents() {
        return Collections.unmodifiableSet(events);
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "웹훅 URL은 필수입니다");
        }
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "웹훅 URL은 http(s)여야 합니다. url: " + url);
            }
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "잘못된 웹훅 URL입니다. url: " + url, e);
        }
    }
}
