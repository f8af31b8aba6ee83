package com.len.kitchen.api.order.dto;

import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.order.OrderLine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RouteOrderRequest(
        @NotBlank(message = "orderId는 필수입니다.")
        String orderId,

        Integer priority,

        String actor,   // 없으면 system

        @NotEmpty(message = "주문 항목은 1개 이상이어야 합니다.")
        List<@NotNull(message = "주문 항목은 null일 수 없습니다.") @Valid Line> lines
) {
    public record Line(
            @NotBlank(message = "lineId는 필수입니다.")
            String lineId,

            String itemName,

            Integer quantity,

            String stationId,

            String notes
    ) {}

    public KitchenOrder toOrder(String hubId) {
        return new KitchenOrder(
                hubId,
                orderId,
                priority == null ? 0 : priority,
                lines.stream()
                        .map(l -> new OrderLine(l.lineId(), l.itemName(),
                                l.quantity() == null ? 1 : l.quantity(), l.stationId(), l.notes()))
                        .toList()
        );
    }
}
