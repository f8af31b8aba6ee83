package com.len.kitchen.application.ticket;

import com.len.kitchen.application.audit.AuditLog;
import com.len.kitchen.application.outbox.TicketEventOutbox;
import com.len.kitchen.common.exception.IllegalTransitionException;
import com.len.kitchen.common.exception.TicketNotFoundException;
import com.len.kitchen.domain.audit.AuditAction;
import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;
import com.len.kitchen.domain.ticket.TicketTrigger;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 티켓 상태 전이의 유일한 진입점.
 * <p>
 * 전이 1건 = 트랜잭션 1개:
 * 티켓 row 락(FOR UPDATE) → 검증 → 상태/시각 변경 → 이력 append → outbox 적재.
 * 이력이나 outbox 저장이 실패하면 상태 변경까지 같이 롤백된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketStateMachine {

    private static final String METRIC_TRANSITION = "kitchen.ticket.transition";

    private final TicketJpaRepository ticketRepository;
    private final AuditLog auditLog;
    private final TicketEventOutbox eventOutbox;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * 새 티켓 저장 + received 이력. autoAccept면 같은 트랜잭션에서 시스템 accept까지.
     */
    @Transactional
    public Ticket open(Ticket ticket, Actor actor, boolean autoAccept) {
        Ticket saved = ticketRepository.save(ticket);
        record(saved, AuditAction.RECEIVED, null, actor, saved.getCreatedAt(), null);

        if (autoAccept) {
            transition(saved, TicketTrigger.ACCEPT, Actor.system());
        }
        return saved;
    }

    @Transactional
    public Ticket apply(Long ticketId, TicketTrigger trigger, Actor actor) {
        Ticket ticket = lock(ticketId);
        transition(ticket, trigger, actor);
        return ticket;
    }

    /**
     * 현재 상태의 다음 정방향 동작 (accept → start → bump → complete → serve).
     */
    @Transactional
    public Ticket advance(Long ticketId, Actor actor) {
        Ticket ticket = lock(ticketId);
        TicketTrigger trigger = ticket.forwardTrigger()
                .orElseThrow(() -> new IllegalTransitionException(ticketId, ticket.getState().name(), "ADVANCE"));
        transition(ticket, trigger, actor);
        return ticket;
    }

    @Transactional
    public Ticket changePriority(Long ticketId, int newPriority, Actor actor) {
        Ticket ticket = lock(ticketId);
        int oldPriority = ticket.changePriority(newPriority);

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime at = now.isBefore(ticket.getLastTransitionAt()) ? ticket.getLastTransitionAt() : now;
        record(ticket, AuditAction.PRIORITY_CHANGED, ticket.getState(), actor, at,
                "priority " + oldPriority + " -> " + newPriority);
        return ticket;
    }

    /**
     * auto-bump 전용. 락을 잡은 뒤 cutoff 기준으로 다시 확인한다.
     * 그 사이 사람이 bump/recall 했으면 여기서 걸러지고 empty.
     */
    @Transactional
    public Optional<Ticket> bumpIfOverdue(Long ticketId, LocalDateTime cutoff) {
        Ticket ticket = lock(ticketId);
        if (ticket.getState() != TicketState.IN_PROGRESS) {
            return Optional.empty();
        }
        if (ticket.getLastTransitionAt().isAfter(cutoff)) {
            return Optional.empty();
        }
        transition(ticket, TicketTrigger.BUMP, Actor.system());
        return Optional.of(ticket);
    }

    private Ticket lock(Long ticketId) {
        if (ticketId == null) {
            throw new TicketNotFoundException(null);
        }
        return ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));
    }

    private void transition(Ticket ticket, TicketTrigger trigger, Actor actor) {
        TicketState from = ticket.apply(trigger, LocalDateTime.now(clock));
        record(ticket, trigger.getAuditAction(), from, actor, ticket.getLastTransitionAt(), null);

        log.debug("Ticket transitioned. ticketId={}, hubId={}, {} -> {}, actor={}",
                ticket.getId(), ticket.getHubId(), from, ticket.getState(), actor.id());
    }

    private void record(Ticket ticket, AuditAction action, TicketState from, Actor actor,
                        LocalDateTime at, String notes) {
        AuditEntry entry = auditLog.append(AuditEntry.of(ticket, action, from, actor.id(), at, notes));
        eventOutbox.record(ticket, entry);
        meterRegistry.counter(METRIC_TRANSITION, "action", action.wireName()).increment();
    }
}
