package io.budgetmart.ecommerce.domain.theme;

import io.budgetmart.ecommerce.domain.common.BaseTimeDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ThemeSettings Document
 *
 * 테넌트당 정확히 하나 (tenant_id 유니크 인덱스). 저장은 문서 전체 교체(upsert)로만 이뤄진다.
 */
@Document(collection = "theme_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ThemeSettings extends BaseTimeDocument {

    public static final String DEFAULT_PRIMARY_COLOR = "#0ea5e9";
    public static final String DEFAULT_HERO_HEADING = "Welcome to our store";
    public static final String DEFAULT_HERO_SUBTEXT = "Everyday essentials at budget-friendly prices";

    @Id
    private String id;

    @Indexed(unique = true)
    private String tenantId;

    private String primaryColor;

    private String heroHeading;

    private String heroSubtext;

    private String logoUrl;

    private List<String> featuredCategories = new ArrayList<>();

    /**
     * 저장된 설정이 없는 테넌트에게 내려주는 기본값 (저장하지 않음)
     */
    public static ThemeSettings defaults(String tenantId) {
        return create(tenantId, null, null, null, null, null);
    }

    public static ThemeSettings create(String tenantId, String primaryColor, String heroHeading, String heroSubtext,
                                       String logoUrl, List<String> featuredCategories) {
        ThemeSettings settings = new ThemeSettings();
        settings.tenantId = tenantId;
        settings.replace(primaryColor, heroHeading, heroSubtext, logoUrl, featuredCategories);
        return settings;
    }

    /**
     * 전체 필드 교체. 비어 있는 값은 기본값으로 채운다.
     */
    public void replace(String primaryColor, String heroHeading, String heroSubtext,
                        String logoUrl, List<String> featuredCategories) {
        this.primaryColor = primaryColor == null ? DEFAULT_PRIMARY_COLOR : primaryColor;
        this.heroHeading = heroHeading == null ? DEFAULT_HERO_HEADING : heroHeading;
        this.heroSubtext = heroSubtext == null ? DEFAULT_HERO_SUBTEXT : heroSubtext;
        this.logoUrl = logoUrl;
        this.featuredCategories = featuredCategories == null ? new ArrayList<>() : new ArrayList<>(featuredCategories);
    }

    public List<String> getFeaturedCategories() {
        return Collections.unmodifiableList(featuredCategories);
    }
}
