package com.len.kitchen.application.outbox;

import com.len.kitchen.domain.audit.AuditAction;
import com.len.kitchen.domain.ticket.TicketState;

import java.time.LocalDateTime;

public record TicketTransitionedPayload(
        String eventId,
        Long auditId,
        Long ticketId,
        String hubId,
        String orderId,
        String orderLineId,
        String stationId,
        AuditAction action,
        TicketState fromState,
        TicketState toState,
        int priority,
        String actor,
        LocalDateTime occurredAt
) {}
