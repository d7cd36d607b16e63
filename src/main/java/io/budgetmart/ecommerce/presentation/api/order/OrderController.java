package io.budgetmart.ecommerce.presentation.api.order;

import io.budgetmart.ecommerce.application.order.dto.CreateOrderRequest;
import io.budgetmart.ecommerce.application.order.dto.CreateOrderResponse;
import io.budgetmart.ecommerce.application.order.dto.OrderResponse;
import io.budgetmart.ecommerce.application.usecase.order.CreateOrderUseCase;
import io.budgetmart.ecommerce.application.usecase.order.GetOrdersUseCase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final CreateOrderUseCase createOrderUseCase;
    private final GetOrdersUseCase getOrdersUseCase;

    /**
     * 주문 생성
     * 응답은 201이 아닌 200 ({id, total, subtotal, discount})
     */
    @PostMapping
    public ResponseEntity<CreateOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.ok(createOrderUseCase.execute(request));
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> getOrders(
            @RequestParam("tenant_id") String tenantId,
            @RequestParam(defaultValue = "100") @Min(1) int limit
    ) {
        return ResponseEntity.ok(getOrdersUseCase.execute(tenantId, limit));
    }
}
