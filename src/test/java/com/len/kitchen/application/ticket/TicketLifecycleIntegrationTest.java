package com.len.kitchen.application.ticket;

import com.len.kitchen.application.routing.RoutingFailure;
import com.len.kitchen.application.routing.RoutingResult;
import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.common.exception.IllegalTransitionException;
import com.len.kitchen.common.exception.TicketNotFoundException;
import com.len.kitchen.domain.audit.AuditAction;
import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.order.OrderLine;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;
import com.len.kitchen.domain.ticket.TicketTrigger;
import com.len.kitchen.application.audit.AuditLog;
import com.len.kitchen.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TicketLifecycleIntegrationTest extends IntegrationTestSupport {

    private static final String HUB = "hub-test";

    @Autowired
    AuditLog auditLog;

    private final Actor cook = Actor.of("cook-1");

    private static LocalDateTime at(long secondsAfterBase) {
        return LocalDateTime.ofInstant(BASE, ZoneOffset.UTC).plusSeconds(secondsAfterBase);
    }

    @Test
    @DisplayName("정방향 전체 흐름: 전이마다 이력 1건, outbox 1건")
    void fullLifecycle_oneAuditEntryPerTransition() {
        Ticket t = newTicket(HUB, 0);

        for (TicketTrigger trigger : List.of(TicketTrigger.ACCEPT, TicketTrigger.START, TicketTrigger.BUMP,
                TicketTrigger.COMPLETE, TicketTrigger.SERVE)) {
            clock.advanceSeconds(30);
            ticketService.transition(t.getId(), trigger, cook);
        }

        List<AuditEntry> history = auditLog.historyOf(t.getId());
        assertThat(history).extracting(AuditEntry::getAction).containsExactly(
                AuditAction.RECEIVED, AuditAction.ACCEPTED, AuditAction.STARTED,
                AuditAction.BUMPED, AuditAction.COMPLETED, AuditAction.SERVED);
        assertThat(history.get(3).getFromState()).isEqualTo(TicketState.IN_PROGRESS);
        assertThat(history.get(3).getToState()).isEqualTo(TicketState.BUMPED);
        assertThat(history.get(3).getOccurredAt()).isEqualTo(at(90));
        assertThat(history.get(0).getActor()).isEqualTo("pos-1");
        assertThat(history.get(5).getActor()).isEqualTo("cook-1");

        Ticket served = ticketRepository.findById(t.getId()).orElseThrow();
        assertThat(served.getState()).isEqualTo(TicketState.SERVED);
        assertThat(served.getServedAt()).isEqualTo(at(150));
        assertThat(outboxEventRepository.count()).isEqualTo(6);
    }

    @Test
    @DisplayName("허용되지 않는 트리거를 두 번 보내도 이력은 남지 않는다")
    void illegalTriggerTwice_noAuditEntries() {
        Ticket t = newTicket(HUB, 0);

        assertThatThrownBy(() -> ticketService.transition(t.getId(), TicketTrigger.SERVE, cook))
                .isInstanceOf(IllegalTransitionException.class);
        assertThatThrownBy(() -> ticketService.transition(t.getId(), TicketTrigger.SERVE, cook))
                .isInstanceOf(IllegalTransitionException.class);

        assertThat(auditLog.countForTicket(t.getId())).isEqualTo(1);
        assertThat(ticketRepository.findById(t.getId()).orElseThrow().getState()).isEqualTo(TicketState.RECEIVED);
    }

    @Test
    @DisplayName("없는 티켓은 TicketNotFound")
    void unknownTicket_notFound() {
        assertThatThrownBy(() -> ticketService.transition(999_999L, TicketTrigger.ACCEPT, cook))
                .isInstanceOf(TicketNotFoundException.class);
    }

    @Test
    @DisplayName("recall 후 다시 bump: 이력에 recalled가 남고 bumpedAt이 새로 찍힌다")
    void recallThenRebump() {
        Ticket t = inProgressTicket(HUB);
        clock.advanceSeconds(60);
        ticketService.transition(t.getId(), TicketTrigger.BUMP, cook);

        clock.advanceSeconds(30);
        Ticket recalled = ticketService.transition(t.getId(), TicketTrigger.RECALL, Actor.of("expo-1"));
        assertThat(recalled.getState()).isEqualTo(TicketState.IN_PROGRESS);
        assertThat(recalled.getBumpedAt()).isNull();

        clock.advanceSeconds(30);
        Ticket rebumped = ticketService.transition(t.getId(), TicketTrigger.BUMP, cook);

        assertThat(rebumped.getBumpedAt()).isEqualTo(at(120));
        List<AuditEntry> history = auditLog.historyOf(t.getId());
        AuditEntry recall = history.get(history.size() - 2);
        assertThat(recall.getAction()).isEqualTo(AuditAction.RECALLED);
        assertThat(recall.getFromState()).isEqualTo(TicketState.BUMPED);
        assertThat(recall.getToState()).isEqualTo(TicketState.IN_PROGRESS);
        assertThat(recall.getActor()).isEqualTo("expo-1");
    }

    @Test
    @DisplayName("advance: 현재 상태의 다음 단계로, 종료 상태면 거부")
    void advance_followsForwardPath() {
        Ticket t = newTicket(HUB, 0);

        for (int i = 0; i < 5; i++) {
            ticketService.advance(t.getId(), cook);
        }

        assertThat(ticketRepository.findById(t.getId()).orElseThrow().getState()).isEqualTo(TicketState.SERVED);
        assertThatThrownBy(() -> ticketService.advance(t.getId(), cook))
                .isInstanceOf(IllegalTransitionException.class);
        assertThat(auditLog.countForTicket(t.getId())).isEqualTo(6);
    }

    @Test
    @DisplayName("우선순위 변경: 이력은 남고 상태/마지막 전이 시각은 그대로")
    void changePriority_recordedWithoutStateChange() {
        Ticket t = inProgressTicket(HUB);
        clock.advanceSeconds(45);

        Ticket changed = ticketService.changePriority(t.getId(), 7, Actor.of("manager"));

        assertThat(changed.getPriority()).isEqualTo(7);
        assertThat(changed.getLastTransitionAt()).isEqualTo(at(0));
        List<AuditEntry> history = auditLog.historyOf(t.getId());
        AuditEntry last = history.get(history.size() - 1);
        assertThat(last.getAction()).isEqualTo(AuditAction.PRIORITY_CHANGED);
        assertThat(last.getFromState()).isEqualTo(TicketState.IN_PROGRESS);
        assertThat(last.getToState()).isEqualTo(TicketState.IN_PROGRESS);
        assertThat(last.getNotes()).isEqualTo("priority 0 -> 7");
    }

    @Test
    @DisplayName("동시에 accept 두 번: 정확히 하나만 성공")
    void concurrentAccept_exactlyOneWins() throws Exception {
        Ticket t = newTicket(HUB, 0);
        int threads = 2;
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger success = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = List.of(acceptTask(t, "cook-a", ready, start, success, rejected),
                    acceptTask(t, "cook-b", ready, start, success, rejected));
            List<Future<Void>> futures = tasks.stream().map(pool::submit).toList();
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();
            for (Future<Void> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(success.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(1);
        assertThat(auditLog.historyOf(t.getId()))
                .filteredOn(e -> e.getAction() == AuditAction.ACCEPTED)
                .hasSize(1);
    }

    private Callable<Void> acceptTask(Ticket t, String actor, CountDownLatch ready, CountDownLatch start,
                                      AtomicInteger success, AtomicInteger rejected) {
        return () -> {
            ready.countDown();
            start.await();
            try {
                ticketService.transition(t.getId(), TicketTrigger.ACCEPT, Actor.of(actor));
                success.incrementAndGet();
            } catch (IllegalTransitionException e) {
                rejected.incrementAndGet();
            }
            return null;
        };
    }

    @Test
    @DisplayName("라우팅: 비활성 스테이션 항목만 실패하고 나머지는 RECEIVED로 생성")
    void route_partialOrder() {
        KitchenOrder order = new KitchenOrder(HUB, "ord-partial", 1, List.of(
                new OrderLine("l1", "Burger", 1, "grill", null),
                new OrderLine("l2", "Fries", 1, "fryer", null),
                new OrderLine("l3", "Mojito", 1, "bar", null)));

        RoutingResult result = ticketService.route(order, Actor.of("pos-1"));

        assertThat(result.tickets()).hasSize(2)
                .allSatisfy(ticket -> assertThat(ticket.getState()).isEqualTo(TicketState.RECEIVED));
        assertThat(result.failures()).extracting(RoutingFailure::errorCode)
                .containsExactly(ErrorCode.STATION_INACTIVE);
        assertThat(ticketRepository.findByOrderIdAndHubIdOrderByIdAsc("ord-partial", HUB)).hasSize(2);

        RoutingResult again = ticketService.route(order, Actor.of("pos-1"));
        assertThat(again.tickets()).isEmpty();
        assertThat(again.failures()).extracting(RoutingFailure::errorCode)
                .containsExactly(ErrorCode.LINE_ALREADY_ROUTED, ErrorCode.LINE_ALREADY_ROUTED,
                        ErrorCode.STATION_INACTIVE);
    }

    @Test
    @DisplayName("auto-accept 허브: 접수와 동시에 시스템이 accept")
    void route_autoAcceptHub() {
        Ticket t = newTicket("hub-auto-accept", 0);

        assertThat(t.getState()).isEqualTo(TicketState.ACCEPTED);
        List<AuditEntry> history = auditLog.historyOf(t.getId());
        assertThat(history).extracting(AuditEntry::getAction)
                .containsExactly(AuditAction.RECEIVED, AuditAction.ACCEPTED);
        assertThat(history.get(1).getActor()).isEqualTo(Actor.SYSTEM_ID);
    }
}
