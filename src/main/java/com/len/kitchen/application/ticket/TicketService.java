package com.len.kitchen.application.ticket;

import com.len.kitchen.application.routing.RoutingResult;
import com.len.kitchen.application.routing.StationRouter;
import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.common.exception.StorageFailureException;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * 단말/외부에서 들어오는 티켓 명령의 진입점.
 * <p>
 * ✅ 여기서는 트랜잭션을 잡지 않는다.
 * - 실제 전이는 {@link TicketStateMachine}의 짧은 트랜잭션에서 처리
 * - 락 경합(데드락/락 타임아웃/버전 충돌)은 새 트랜잭션으로 짧게 재시도한다.
 *   재시도 때마다 티켓을 다시 읽고 검증하므로 경합에서 진 쪽은 IllegalTransition으로 끝난다.
 * - 그 밖의 저장소 오류는 StorageFailure로 바꿔서 호출자가 재시도하게 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketService {

    private static final int MAX_ATTEMPTS = 5;
    private static final long INITIAL_BACKOFF_MS = 10;
    private static final long MAX_BACKOFF_MS = 100;

    private final TicketStateMachine stateMachine;
    private final StationRouter stationRouter;

    public RoutingResult route(KitchenOrder order, Actor actor) {
        // 항목별로 이미 커밋되므로 라우팅 전체를 재시도하지 않는다
        try {
            return stationRouter.route(order, actor);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure. operation=route, orderId={}", order == null ? null : order.orderId(), e);
            throw new StorageFailureException(e);
        }
    }

    public Ticket transition(Long ticketId, TicketTrigger trigger, Actor actor) {
        if (trigger == null) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "trigger는 필수입니다.");
        }
        return execute("transition", () -> stateMachine.apply(ticketId, trigger, actor));
    }

    public Ticket advance(Long ticketId, Actor actor) {
        return execute("advance", () -> stateMachine.advance(ticketId, actor));
    }

    public Ticket changePriority(Long ticketId, int newPriority, Actor actor) {
        return execute("changePriority", () -> stateMachine.changePriority(ticketId, newPriority, actor));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        long backoffMs = INITIAL_BACKOFF_MS;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    log.error("Lock contention not resolved. operation={}, attempts={}", operation, attempt, e);
                    throw new StorageFailureException(e);
                }
                log.warn("Lock contention, retrying. operation={}, attempt={}, err={}",
                        operation, attempt, e.getClass().getSimpleName());
                sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            } catch (DataAccessException | TransactionException e) {
                log.error("Storage failure. operation={}", operation, e);
                throw new StorageFailureException(e);
            }
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
