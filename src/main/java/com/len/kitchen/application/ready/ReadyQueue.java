package com.len.kitchen.application.ready;

import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 픽업 대기(BUMPED) 티켓 목록. 따로 저장하지 않고 매번 티켓 상태로부터 계산한다.
 * 정렬: priority desc, bumpedAt asc.
 */
@Service
@RequiredArgsConstructor
public class ReadyQueue {

    private final TicketJpaRepository ticketRepository;

    @Transactional(readOnly = true)
    public List<Ticket> list(String hubId) {
        return ticketRepository.findReadyQueue(hubId);
    }
}
