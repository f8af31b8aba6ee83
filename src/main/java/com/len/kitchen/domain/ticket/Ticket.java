package com.len.kitchen.domain.ticket;

import com.len.kitchen.common.exception.IllegalTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Optional;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "kitchen_ticket",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_ticket_order_line",
                        columnNames = {"hub_id", "order_id", "order_line_id"}
                )
        },
        indexes = {
                @Index(name = "ix_ticket_hub_station_state", columnList = "hub_id, station_id, state"),
                @Index(name = "ix_ticket_hub_state_transition", columnList = "hub_id, state, last_transition_at")
        }
)
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hub_id", nullable = false, length = 64)
    private String hubId;

    // 주문/주문항목은 식별자만 들고 있는다 (소유하지 않음)
    @Column(name = "order_id", nullable = false, length = 64)
    private String orderId;

    @Column(name = "order_line_id", nullable = false, length = 64)
    private String orderLineId;

    @Column(name = "item_name", length = 200)
    private String itemName;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "station_id", nullable = false, length = 64)
    private String stationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private TicketState state;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "accepted_at")
    private LocalDateTime acceptedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "bumped_at")
    private LocalDateTime bumpedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "served_at")
    private LocalDateTime servedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "last_transition_at", nullable = false)
    private LocalDateTime lastTransitionAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public static Ticket receive(String hubId, String orderId, String orderLineId, String stationId,
                                 String itemName, int quantity, String notes, int priority,
                                 LocalDateTime now) {
        Ticket t = new Ticket();
        t.hubId = hubId;
        t.orderId = orderId;
        t.orderLineId = orderLineId;
        t.stationId = stationId;
        t.itemName = itemName;
        t.quantity = Math.max(quantity, 1);
        t.notes = notes;
        t.priority = priority;
        t.state = TicketState.RECEIVED;
        t.createdAt = now;
        t.lastTransitionAt = now;
        return t;
    }

    /**
     * 트리거 적용. 허용되지 않으면 아무것도 바꾸지 않고 예외.
     *
     * @return 전이 직전 상태
     */
    public TicketState apply(TicketTrigger trigger, LocalDateTime now) {
        TicketState from = this.state;
        TicketState to = nextState(trigger)
                .orElseThrow(() -> new IllegalTransitionException(id, from.name(), trigger.name()));

        // 시계가 뒤로 가도 이전 전이보다 앞선 시각은 찍지 않는다
        LocalDateTime at = now.isBefore(lastTransitionAt) ? lastTransitionAt : now;

        if (trigger == TicketTrigger.RECALL) {
            clearStamp(from);
        } else {
            stamp(to, at);
        }
        this.state = to;
        this.lastTransitionAt = at;
        return from;
    }

    /**
     * 현재 상태에서 trigger 적용 시 도착 상태. 불가하면 empty.
     */
    public Optional<TicketState> nextState(TicketTrigger trigger) {
        return Optional.ofNullable(switch (trigger) {
            case ACCEPT -> state == TicketState.RECEIVED ? TicketState.ACCEPTED : null;
            case START -> state == TicketState.ACCEPTED ? TicketState.IN_PROGRESS : null;
            case BUMP -> state == TicketState.IN_PROGRESS ? TicketState.BUMPED : null;
            case COMPLETE -> state == TicketState.BUMPED ? TicketState.COMPLETED : null;
            case SERVE -> state == TicketState.COMPLETED ? TicketState.SERVED : null;
            case CANCEL -> (state.isActive() || state == TicketState.BUMPED) ? TicketState.CANCELLED : null;
            case RECALL -> previousState();
        });
    }

    /**
     * 다음 정방향 트리거 (quick advance). 종료 상태면 empty.
     */
    public Optional<TicketTrigger> forwardTrigger() {
        return Optional.ofNullable(switch (state) {
            case RECEIVED -> TicketTrigger.ACCEPT;
            case ACCEPTED -> TicketTrigger.START;
            case IN_PROGRESS -> TicketTrigger.BUMP;
            case BUMPED -> TicketTrigger.COMPLETE;
            case COMPLETED -> TicketTrigger.SERVE;
            case SERVED, CANCELLED -> null;
        });
    }

    public int changePriority(int newPriority) {
        if (state.isTerminal()) {
            throw new IllegalTransitionException(id, state.name(), "CHANGE_PRIORITY");
        }
        int old = this.priority;
        this.priority = newPriority;
        return old;
    }

    // recall은 한 단계만 되돌린다. RECEIVED 이전은 없음
    private TicketState previousState() {
        return switch (state) {
            case ACCEPTED -> TicketState.RECEIVED;
            case IN_PROGRESS -> TicketState.ACCEPTED;
            case BUMPED -> TicketState.IN_PROGRESS;
            case COMPLETED -> TicketState.BUMPED;
            default -> null;
        };
    }

    private void stamp(TicketState entered, LocalDateTime at) {
        switch (entered) {
            case ACCEPTED -> this.acceptedAt = at;
            case IN_PROGRESS -> this.startedAt = at;
            case BUMPED -> this.bumpedAt = at;
            case COMPLETED -> this.completedAt = at;
            case SERVED -> this.servedAt = at;
            case CANCELLED -> this.cancelledAt = at;
            default -> { }
        }
    }

    // 되돌린 단계의 시각만 지운다. 다시 진입하면 새로 찍힌다
    private void clearStamp(TicketState left) {
        switch (left) {
            case ACCEPTED -> this.acceptedAt = null;
            case IN_PROGRESS -> this.startedAt = null;
            case BUMPED -> this.bumpedAt = null;
            case COMPLETED -> this.completedAt = null;
            default -> { }
        }
    }
}
