package com.len.kitchen.infra.ticket;

import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketState;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TicketJpaRepository extends JpaRepository<Ticket, Long> {

    // 전이 1건 동안 티켓 row 배타 락
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Ticket t where t.id = :id")
    Optional<Ticket> findByIdForUpdate(@Param("id") Long id);

    boolean existsByHubIdAndOrderIdAndOrderLineId(String hubId, String orderId, String orderLineId);

    List<Ticket> findByOrderIdAndHubIdOrderByIdAsc(String orderId, String hubId);

    // ready queue: 우선순위 높은 순, 같으면 먼저 bump된 순
    @Query("""
        select t from Ticket t
        where t.hubId = :hubId
          and t.state = com.len.kitchen.domain.ticket.TicketState.BUMPED
        order by t.priority desc, t.bumpedAt asc, t.id asc
    """)
    List<Ticket> findReadyQueue(@Param("hubId") String hubId);

    @Query(value = """
        select t from Ticket t
        where t.hubId = :hubId
          and t.state in :states
        order by t.priority desc, t.createdAt asc, t.id asc
    """, countQuery = """
        select count(t) from Ticket t
        where t.hubId = :hubId
          and t.state in :states
    """)
    Page<Ticket> findBoard(@Param("hubId") String hubId,
                           @Param("states") Collection<TicketState> states,
                           Pageable pageable);

    @Query("""
        select t.state as state, count(t) as total
        from Ticket t
        where t.hubId = :hubId
          and t.state in :states
        group by t.state
    """)
    List<StateCount> countByState(@Param("hubId") String hubId,
                                  @Param("states") Collection<TicketState> states);

    @Query("select distinct t.hubId from Ticket t where t.state = :state")
    List<String> findHubIdsWithState(@Param("state") TicketState state);

    // auto-bump 후보. 락 없이 id만 뽑고, 실제 전이는 티켓 단위로 락 잡고 재검증
    @Query("""
        select t.id from Ticket t
        where t.hubId = :hubId
          and t.state = com.len.kitchen.domain.ticket.TicketState.IN_PROGRESS
          and t.lastTransitionAt <= :cutoff
        order by t.lastTransitionAt asc
    """)
    List<Long> findOverdueInProgressIds(@Param("hubId") String hubId,
                                        @Param("cutoff") LocalDateTime cutoff,
                                        Pageable pageable);

    interface StateCount {
        TicketState getState();

        long getTotal();
    }
}
