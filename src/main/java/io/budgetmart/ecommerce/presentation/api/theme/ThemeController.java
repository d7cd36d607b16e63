package io.budgetmart.ecommerce.presentation.api.theme;

import io.budgetmart.ecommerce.application.theme.dto.SaveThemeRequest;
import io.budgetmart.ecommerce.application.theme.dto.ThemeResponse;
import io.budgetmart.ecommerce.application.usecase.theme.GetThemeUseCase;
import io.budgetmart.ecommerce.application.usecase.theme.SaveThemeUseCase;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/theme")
@RequiredArgsConstructor
public class ThemeController {

    private final GetThemeUseCase getThemeUseCase;
    private final SaveThemeUseCase saveThemeUseCase;

    @GetMapping
    public ResponseEntity<ThemeResponse> getTheme(@RequestParam("tenant_id") String tenantId) {
        return ResponseEntity.ok(getThemeUseCase.execute(tenantId));
    }

    @PostMapping
    public ResponseEntity<ThemeResponse> saveTheme(@Valid @RequestBody SaveThemeRequest request) {
        return ResponseEntity.ok(saveThemeUseCase.execute(request));
    }
}
