package io.budgetmart.ecommerce.presentation.api.webhook;

import io.budgetmart.ecommerce.application.common.dto.IdResponse;
import io.budgetmart.ecommerce.application.usecase.webhook.CreateWebhookUseCase;
import io.budgetmart.ecommerce.application.usecase.webhook.GetWebhooksUseCase;
import io.budgetmart.ecommerce.application.webhook.dto.CreateWebhookRequest;
import io.budgetmart.ecommerce.application.webhook.dto.WebhookResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final CreateWebhookUseCase createWebhookUseCase;
    private final GetWebhooksUseCase getWebhooksUseCase;

    @PostMapping
    public ResponseEntity<IdResponse> createWebhook(@Valid @RequestBody CreateWebhookRequest request) {
        return ResponseEntity.ok(createWebhookUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<WebhookResponse>> getWebhooks(
            @RequestParam("tenant_id") String tenantId,
            @RequestParam(required = false) Boolean active,
            @RequestParam(defaultValue = "100") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getWebhooksUseCase.execute(tenantId, active, limit));
    }
}
