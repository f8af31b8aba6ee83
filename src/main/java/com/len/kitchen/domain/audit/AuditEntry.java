package com.len.kitchen.domain.audit;

import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 티켓 상태 변경 이력. 한 번 기록되면 수정/삭제하지 않는다.
 * id(IDENTITY)가 기록 순서를 나타내는 시퀀스.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "kitchen_audit_entry",
        indexes = {
                @Index(name = "ix_audit_ticket", columnList = "ticket_id"),
                @Index(name = "ix_audit_hub_occurred", columnList = "hub_id, occurred_at")
        }
)
public class AuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hub_id", nullable = false, length = 64, updatable = false)
    private String hubId;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private Long ticketId;

    @Column(name = "order_id", nullable = false, length = 64, updatable = false)
    private String orderId;

    @Column(name = "order_line_id", length = 64, updatable = false)
    private String orderLineId;

    @Column(name = "station_id", length = 64, updatable = false)
    private String stationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20, updatable = false)
    private AuditAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", length = 20, updatable = false)
    private TicketState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, length = 20, updatable = false)
    private TicketState toState;

    @Column(name = "actor", nullable = false, length = 100, updatable = false)
    private String actor;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    @Column(name = "notes", length = 500, updatable = false)
    private String notes;

    public static AuditEntry of(Ticket ticket, AuditAction action, TicketState fromState,
                                String actor, LocalDateTime occurredAt, String notes) {
        AuditEntry e = new AuditEntry();
        e.hubId = ticket.getHubId();
        e.ticketId = ticket.getId();
        e.orderId = ticket.getOrderId();
        e.orderLineId = ticket.getOrderLineId();
        e.stationId = ticket.getStationId();
        e.action = action;
        e.fromState = fromState;
        e.toState = ticket.getState();
        e.actor = actor;
        e.occurredAt = occurredAt;
        e.notes = notes;
        return e;
    }
}
