package com.len.kitchen.api.history.dto;

import com.len.kitchen.domain.audit.AuditAction;
import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.domain.ticket.TicketState;

import java.time.LocalDateTime;

public record AuditEntryResponse(
        Long sequence,
        Long ticketId,
        String orderId,
        String orderLineId,
        String stationId,
        AuditAction action,
        TicketState fromState,
        TicketState toState,
        String actor,
        LocalDateTime occurredAt,
        String notes
) {
    public static AuditEntryResponse from(AuditEntry e) {
        return new AuditEntryResponse(
                e.getId(),
                e.getTicketId(),
                e.getOrderId(),
                e.getOrderLineId(),
                e.getStationId(),
                e.getAction(),
                e.getFromState(),
                e.getToState(),
                e.getActor(),
                e.getOccurredAt(),
                e.getNotes()
        );
    }
}
