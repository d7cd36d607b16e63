package io.budgetmart.ecommerce.domain.theme;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThemeSettingsTest {

    @Test
    @DisplayName("기본 테마 값")
    void defaults() {
        ThemeSettings settings = ThemeSettings.defaults("665f1c2e9b1d8a3f4c2e1a01");

        assertThat(settings.getPrimaryColor()).isEqualTo("#0ea5e9");
        assertThat(settings.getHeroHeading()).isEqualTo("Welcome to our store");
        assertThat(settings.getHeroSubtext()).isEqualTo("Everyday essentials at budget-friendly prices");
        assertThat(settings.getLogoUrl()).isNull();
        assertThat(settings.getFeaturedCategories()).isEmpty();
    }

    @Test
    @DisplayName("전체 교체 - 이전 값은 남지 않는다")
    void replace_전체교체() {
        // Given
        ThemeSettings settings = ThemeSettings.create("665f1c2e9b1d8a3f4c2e1a01", "#111111", "Hi", "Sub",
            "https://cdn.example.com/logo.png", List.of("shoes", "bags"));

        // When
        settings.replace("#222222", null, null, null, List.of("hats"));

        // Then
        assertThat(settings.getPrimaryColor()).isEqualTo("#222222");
        assertThat(settings.getHeroHeading()).isEqualTo(ThemeSettings.DEFAULT_HERO_HEADING);
        assertThat(settings.getLogoUrl()).isNull();
        assertThat(settings.getFeaturedCategories()).containsExactly("hats");
    }
}
