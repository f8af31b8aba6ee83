package com.len.kitchen.application.intake;

import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.order.OrderLine;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 주문 시스템이 발행하는 주문 생성 이벤트 (kitchen.order.placed.v1).
 */
public record OrderPlacedPayload(
        String eventId,
        String hubId,
        String orderId,
        Integer priority,
        String placedBy,
        List<Line> lines,
        Instant placedAt
) {
    public record Line(
            String lineId,
            String itemName,
            Integer quantity,
            String stationId,
            String notes
    ) {}

    public KitchenOrder toOrder() {
        if (lines != null && lines.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "주문 항목에 null이 있습니다. orderId=" + orderId);
        }
        List<OrderLine> orderLines = lines == null ? List.of() : lines.stream()
                .map(l -> new OrderLine(
                        l.lineId(),
                        l.itemName(),
                        l.quantity() == null ? 1 : l.quantity(),
                        l.stationId(),
                        l.notes()))
                .toList();
        return new KitchenOrder(hubId, orderId, priority == null ? 0 : priority, orderLines);
    }
}
