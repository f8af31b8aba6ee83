package com.len.kitchen.application.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.domain.outbox.OutboxEvent;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.infra.outbox.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * 티켓 전이 이벤트를 outbox에 적재. 발행은 {@code OutboxPublisher}가 따로 한다.
 */
@Service
@RequiredArgsConstructor
public class TicketEventOutbox {

    public static final String TOPIC = "kitchen.ticket.transitioned.v1";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(Ticket ticket, AuditEntry entry) {
        String eventId = UUID.randomUUID().toString();

        TicketTransitionedPayload payload = new TicketTransitionedPayload(
                eventId,
                entry.getId(),
                ticket.getId(),
                ticket.getHubId(),
                ticket.getOrderId(),
                ticket.getOrderLineId(),
                ticket.getStationId(),
                entry.getAction(),
                entry.getFromState(),
                entry.getToState(),
                ticket.getPriority(),
                entry.getActor(),
                entry.getOccurredAt()
        );

        try {
            String json = objectMapper.writeValueAsString(payload);
            outboxEventRepository.save(
                    OutboxEvent.forTicket(eventId, TOPIC, ticket.getId(), json, entry.getOccurredAt())
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Outbox payload serialize failed", e);
        }
    }
}
