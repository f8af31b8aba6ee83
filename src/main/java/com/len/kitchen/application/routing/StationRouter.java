package com.len.kitchen.application.routing;

import com.len.kitchen.application.ticket.TicketStateMachine;
import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.common.exception.RoutingException;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.order.OrderLine;
import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.settings.KitchenSettingsProvider;
import com.len.kitchen.domain.station.Station;
import com.len.kitchen.domain.station.StationDirectory;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 항목마다 티켓 1개를 만들어 지정된 스테이션에 배정한다.
 * <p>
 * 여기서는 트랜잭션을 잡지 않는다. 항목 하나가 실패해도 다른 항목은 그대로 생성되어야 해서
 * 티켓 생성은 항목 단위로 {@link TicketStateMachine#open}의 짧은 트랜잭션에서 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StationRouter {

    private static final String METRIC_ROUTED = "kitchen.routing.lines";

    private final StationDirectory stationDirectory;
    private final KitchenSettingsProvider settingsProvider;
    private final TicketJpaRepository ticketRepository;
    private final TicketStateMachine stateMachine;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RoutingResult route(KitchenOrder order, Actor actor) {
        if (order == null || isBlank(order.hubId()) || isBlank(order.orderId())) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "hubId/orderId는 필수입니다.");
        }
        if (order.lines().isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "주문 항목이 없습니다. orderId=" + order.orderId());
        }

        KitchenSettings settings = settingsProvider.settingsFor(order.hubId());

        List<Ticket> tickets = new ArrayList<>();
        List<RoutingFailure> failures = new ArrayList<>();

        for (OrderLine line : order.lines()) {
            try {
                tickets.add(routeLine(order, line, actor, settings));
                meterRegistry.counter(METRIC_ROUTED, "result", "routed").increment();
            } catch (RoutingException e) {
                failures.add(RoutingFailure.of(e));
                meterRegistry.counter(METRIC_ROUTED, "result", e.getErrorCode().getCode()).increment();
                log.warn("Order line not routed. hubId={}, orderId={}, lineId={}, stationId={}, code={}",
                        order.hubId(), order.orderId(), line.lineId(), line.stationId(), e.getErrorCode());
            }
        }

        log.info("Order routed. hubId={}, orderId={}, tickets={}, failures={}, autoAccept={}",
                order.hubId(), order.orderId(), tickets.size(), failures.size(), settings.autoAcceptEnabled());

        return new RoutingResult(order.hubId(), order.orderId(), tickets, failures);
    }

    private Ticket routeLine(KitchenOrder order, OrderLine line, Actor actor, KitchenSettings settings) {
        if (isBlank(line.lineId())) {
            throw new RoutingException(ErrorCode.INVALID_REQUEST, line.lineId(), line.stationId());
        }

        Station station = stationDirectory.findStation(order.hubId(), line.stationId())
                .orElseThrow(() -> new RoutingException(ErrorCode.STATION_NOT_FOUND, line.lineId(), line.stationId()));

        if (!station.active()) {
            throw new RoutingException(ErrorCode.STATION_INACTIVE, line.lineId(), line.stationId());
        }

        if (ticketRepository.existsByHubIdAndOrderIdAndOrderLineId(order.hubId(), order.orderId(), line.lineId())) {
            throw new RoutingException(ErrorCode.LINE_ALREADY_ROUTED, line.lineId(), line.stationId());
        }

        Ticket ticket = Ticket.receive(
                order.hubId(),
                order.orderId(),
                line.lineId(),
                station.stationId(),
                line.itemName(),
                line.quantity(),
                line.notes(),
                order.priority(),
                LocalDateTime.now(clock)
        );

        try {
            return stateMachine.open(ticket, actor, settings.autoAcceptEnabled());
        } catch (DataIntegrityViolationException e) {
            // 같은 항목이 동시에 두 번 들어온 경우 유니크 제약(uk_ticket_order_line)에서 걸림
            throw new RoutingException(ErrorCode.LINE_ALREADY_ROUTED, line.lineId(), line.stationId());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
