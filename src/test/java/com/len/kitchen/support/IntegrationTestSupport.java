package com.len.kitchen.support;

import com.len.kitchen.application.ticket.TicketService;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.order.OrderLine;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.infra.audit.AuditEntryJpaRepository;
import com.len.kitchen.infra.outbox.OutboxEventRepository;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * H2 + 조작 가능한 Clock으로 띄우는 통합 테스트 공통 설정.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(IntegrationTestSupport.ClockConfig.class)
public abstract class IntegrationTestSupport {

    protected static final Instant BASE = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected TicketService ticketService;

    @Autowired
    protected TicketJpaRepository ticketRepository;

    @Autowired
    protected AuditEntryJpaRepository auditRepository;

    @Autowired
    protected OutboxEventRepository outboxEventRepository;

    @BeforeEach
    void resetState() {
        outboxEventRepository.deleteAllInBatch();
        auditRepository.deleteAllInBatch();
        ticketRepository.deleteAllInBatch();
        clock.setInstant(BASE);
    }

    protected Ticket newTicket(String hubId, int priority) {
        String orderId = "ord-" + UUID.randomUUID();
        KitchenOrder order = new KitchenOrder(hubId, orderId, priority,
                List.of(new OrderLine("line-1", "Burger", 1, "grill", null)));
        return ticketService.route(order, Actor.of("pos-1")).tickets().get(0);
    }

    protected Ticket inProgressTicket(String hubId) {
        Ticket t = newTicket(hubId, 0);
        ticketService.transition(t.getId(), com.len.kitchen.domain.ticket.TicketTrigger.ACCEPT, Actor.of("cook-1"));
        return ticketService.transition(t.getId(), com.len.kitchen.domain.ticket.TicketTrigger.START, Actor.of("cook-1"));
    }

    @TestConfiguration
    static class ClockConfig {

        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(BASE);
        }
    }
}
