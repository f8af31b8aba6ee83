package com.len.kitchen.api.order;

import com.len.kitchen.api.order.dto.RouteOrderRequest;
import com.len.kitchen.api.order.dto.RoutingResponse;
import com.len.kitchen.application.ticket.TicketService;
import com.len.kitchen.domain.ticket.Actor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/kitchen/hubs/{hubId}/orders")
public class OrderIntakeController {

    private final TicketService ticketService;

    /**
     * 주문 접수 → 항목별 티켓 생성.
     * 일부 항목 실패(스테이션 없음/비활성 등)는 failures로 내려가고 나머지는 정상 생성된다.
     */
    @PostMapping
    public RoutingResponse route(@PathVariable String hubId,
                                 @Valid @RequestBody RouteOrderRequest request) {
        Actor actor = (request.actor() == null || request.actor().isBlank())
                ? Actor.system()
                : Actor.of(request.actor());

        return RoutingResponse.from(ticketService.route(request.toOrder(hubId), actor));
    }
}
