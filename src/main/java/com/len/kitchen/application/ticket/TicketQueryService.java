package com.len.kitchen.application.ticket;

import com.len.kitchen.application.audit.AuditFilter;
import com.len.kitchen.application.audit.AuditLog;
import com.len.kitchen.application.ready.ReadyQueue;
import com.len.kitchen.application.timer.EscalationEngine;
import com.len.kitchen.common.exception.TicketNotFoundException;
import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.settings.KitchenSettingsProvider;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 디스플레이 화면용 조회. 모두 읽기 전용 트랜잭션이라 전이(쓰기)를 막지 않는다.
 */
@Service
@RequiredArgsConstructor
public class TicketQueryService {

    private static final Set<TicketState> ACTIVE_STATES =
            EnumSet.of(TicketState.RECEIVED, TicketState.ACCEPTED, TicketState.IN_PROGRESS);

    private static final Set<TicketState> BOARD_STATES =
            EnumSet.of(TicketState.RECEIVED, TicketState.ACCEPTED, TicketState.IN_PROGRESS,
                    TicketState.BUMPED, TicketState.COMPLETED);

    private static final int MAX_HISTORY_PAGE_SIZE = 200;

    private final TicketJpaRepository ticketRepository;
    private final ReadyQueue readyQueue;
    private final AuditLog auditLog;
    private final EscalationEngine escalationEngine;
    private final KitchenSettingsProvider settingsProvider;

    @Transactional(readOnly = true)
    public TicketView get(Long ticketId) {
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));
        KitchenSettings settings = settingsProvider.settingsFor(ticket.getHubId());
        return new TicketView(ticket, escalationEngine.timingOf(ticket, settings));
    }

    /**
     * 접수/확인/조리중 티켓. 페이지 크기는 허브 설정의 itemsPerPage.
     */
    @Transactional(readOnly = true)
    public Page<TicketView> listActive(String hubId, int page) {
        KitchenSettings settings = settingsProvider.settingsFor(hubId);
        int size = Math.max(settings.itemsPerPage(), 1);

        return ticketRepository.findBoard(hubId, ACTIVE_STATES, PageRequest.of(Math.max(page, 0), size))
                .map(t -> new TicketView(t, escalationEngine.timingOf(t, settings)));
    }

    @Transactional(readOnly = true)
    public List<TicketView> listReady(String hubId) {
        KitchenSettings settings = settingsProvider.settingsFor(hubId);
        return readyQueue.list(hubId).stream()
                .map(t -> new TicketView(t, escalationEngine.timingOf(t, settings)))
                .toList();
    }

    @Transactional(readOnly = true)
    public BoardSummary summary(String hubId) {
        Map<TicketState, Long> counts = new EnumMap<>(TicketState.class);
        for (TicketJpaRepository.StateCount c : ticketRepository.countByState(hubId, BOARD_STATES)) {
            counts.put(c.getState(), c.getTotal());
        }
        return new BoardSummary(
                hubId,
                counts.getOrDefault(TicketState.RECEIVED, 0L),
                counts.getOrDefault(TicketState.ACCEPTED, 0L),
                counts.getOrDefault(TicketState.IN_PROGRESS, 0L),
                counts.getOrDefault(TicketState.BUMPED, 0L),
                counts.getOrDefault(TicketState.COMPLETED, 0L)
        );
    }

    public Slice<AuditEntry> listHistory(AuditFilter filter, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), MAX_HISTORY_PAGE_SIZE);
        return auditLog.query(filter, PageRequest.of(Math.max(page, 0), pageSize));
    }

    public KitchenSettings settings(String hubId) {
        return settingsProvider.settingsFor(hubId);
    }
}
