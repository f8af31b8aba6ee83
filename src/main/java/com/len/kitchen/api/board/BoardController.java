package com.len.kitchen.api.board;

import com.len.kitchen.api.board.dto.BoardPageResponse;
import com.len.kitchen.api.ticket.dto.TicketResponse;
import com.len.kitchen.application.ticket.BoardSummary;
import com.len.kitchen.application.ticket.TicketQueryService;
import com.len.kitchen.domain.settings.KitchenSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/kitchen/hubs/{hubId}")
public class BoardController {

    private final TicketQueryService ticketQueryService;

    /**
     * 접수/확인/조리중 티켓 + 경과 시간/긴급도
     * GET /api/kitchen/hubs/hub-1/tickets/active?page=0
     */
    @GetMapping("/tickets/active")
    public BoardPageResponse active(@PathVariable String hubId,
                                    @RequestParam(defaultValue = "0") int page) {
        return BoardPageResponse.from(ticketQueryService.listActive(hubId, page));
    }

    @GetMapping("/tickets/ready")
    public List<TicketResponse> ready(@PathVariable String hubId) {
        return ticketQueryService.listReady(hubId).stream()
                .map(TicketResponse::from)
                .toList();
    }

    @GetMapping("/tickets/summary")
    public BoardSummary summary(@PathVariable String hubId) {
        return ticketQueryService.summary(hubId);
    }

    @GetMapping("/settings")
    public KitchenSettings settings(@PathVariable String hubId) {
        return ticketQueryService.settings(hubId);
    }
}
