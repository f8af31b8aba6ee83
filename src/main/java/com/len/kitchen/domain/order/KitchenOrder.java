package com.len.kitchen.domain.order;

import java.util.List;

/**
 * 주문 시스템에서 넘어오는 주문. 주방은 이 값을 소유하지 않고 티켓 생성에만 쓴다.
 */
public record KitchenOrder(
        String hubId,
        String orderId,
        int priority,
        List<OrderLine> lines
) {
    public KitchenOrder {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
