package io.budgetmart.ecommerce.application.usecase.order;

import io.budgetmart.ecommerce.application.common.ListLimit;
import io.budgetmart.ecommerce.application.order.dto.OrderResponse;
import io.budgetmart.ecommerce.application.usecase.UseCase;
import io.budgetmart.ecommerce.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@UseCase
@RequiredArgsConstructor
public class GetOrdersUseCase {

    private final OrderRepository orderRepository;

    public List<OrderResponse> execute(String tenantId, int limit) {
        log.info("Getting orders for tenantId: {}", tenantId);

        List<OrderResponse> orders = orderRepository.findByTenantId(tenantId, ListLimit.of(limit)).stream()
            .map(OrderResponse::from)
            .toList();

        log.debug("Found {} orders", orders.size());
        return orders;
    }
}
