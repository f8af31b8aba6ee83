package com.len.kitchen.application.routing;

import com.len.kitchen.domain.ticket.Ticket;

import java.util.List;

/**
 * 주문 1건 라우팅 결과. 일부 항목만 실패해도 나머지 티켓은 생성된다.
 */
public record RoutingResult(
        String hubId,
        String orderId,
        List<Ticket> tickets,
        List<RoutingFailure> failures
) {
    public RoutingResult {
        tickets = List.copyOf(tickets);
        failures = List.copyOf(failures);
    }

    public boolean isPartial() {
        return !failures.isEmpty() && !tickets.isEmpty();
    }

    public boolean isFullyRouted() {
        return failures.isEmpty();
    }
}
