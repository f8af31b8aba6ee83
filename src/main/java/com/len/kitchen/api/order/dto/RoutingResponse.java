package com.len.kitchen.api.order.dto;

import com.len.kitchen.api.ticket.dto.TicketResponse;
import com.len.kitchen.application.routing.RoutingFailure;
import com.len.kitchen.application.routing.RoutingResult;

import java.util.List;

public record RoutingResponse(
        String hubId,
        String orderId,
        boolean fullyRouted,
        List<TicketResponse> tickets,
        List<Failure> failures
) {
    public record Failure(String lineId, String stationId, String code, String message) {
        static Failure from(RoutingFailure f) {
            return new Failure(f.orderLineId(), f.stationId(), f.errorCode().getCode(), f.message());
        }
    }

    public static RoutingResponse from(RoutingResult result) {
        return new RoutingResponse(
                result.hubId(),
                result.orderId(),
                result.isFullyRouted(),
                result.tickets().stream().map(TicketResponse::from).toList(),
                result.failures().stream().map(Failure::from).toList()
        );
    }
}
