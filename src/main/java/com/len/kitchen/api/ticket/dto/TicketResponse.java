package com.len.kitchen.api.ticket.dto;

import com.len.kitchen.application.ticket.TicketView;
import com.len.kitchen.application.timer.EscalationLevel;
import com.len.kitchen.application.timer.TicketTiming;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;

import java.time.LocalDateTime;

public record TicketResponse(
        Long ticketId,
        String hubId,
        String orderId,
        String orderLineId,
        String stationId,
        String itemName,
        int quantity,
        String notes,
        TicketState state,
        int priority,
        LocalDateTime createdAt,
        LocalDateTime acceptedAt,
        LocalDateTime startedAt,
        LocalDateTime bumpedAt,
        LocalDateTime completedAt,
        LocalDateTime servedAt,
        LocalDateTime cancelledAt,
        LocalDateTime lastTransitionAt,
        Long elapsedSeconds,      // 조회 API에서만 채움
        EscalationLevel escalation
) {
    public static TicketResponse from(Ticket t) {
        return from(t, null);
    }

    public static TicketResponse from(TicketView view) {
        return from(view.ticket(), view.timing());
    }

    public static TicketResponse from(Ticket t, TicketTiming timing) {
        return new TicketResponse(
                t.getId(),
                t.getHubId(),
                t.getOrderId(),
                t.getOrderLineId(),
                t.getStationId(),
                t.getItemName(),
                t.getQuantity(),
                t.getNotes(),
                t.getState(),
                t.getPriority(),
                t.getCreatedAt(),
                t.getAcceptedAt(),
                t.getStartedAt(),
                t.getBumpedAt(),
                t.getCompletedAt(),
                t.getServedAt(),
                t.getCancelledAt(),
                t.getLastTransitionAt(),
                timing == null ? null : timing.elapsedSeconds(),
                timing == null ? null : timing.level()
        );
    }
}
