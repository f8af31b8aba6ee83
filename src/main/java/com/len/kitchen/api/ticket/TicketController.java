package com.len.kitchen.api.ticket;

import com.len.kitchen.api.ticket.dto.AdvanceRequest;
import com.len.kitchen.api.ticket.dto.ChangePriorityRequest;
import com.len.kitchen.api.ticket.dto.TicketResponse;
import com.len.kitchen.api.ticket.dto.TransitionRequest;
import com.len.kitchen.application.ticket.TicketQueryService;
import com.len.kitchen.application.ticket.TicketService;
import com.len.kitchen.domain.ticket.Actor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/kitchen/tickets")
public class TicketController {

    private final TicketService ticketService;
    private final TicketQueryService ticketQueryService;

    @GetMapping("/{ticketId}")
    public TicketResponse get(@PathVariable Long ticketId) {
        return TicketResponse.from(ticketQueryService.get(ticketId));
    }

    /**
     * accept / start / bump / complete / serve / cancel / recall
     * POST /api/kitchen/tickets/1/transitions {"trigger":"BUMP","actor":"cook-1"}
     */
    @PostMapping("/{ticketId}/transitions")
    public TicketResponse transition(@PathVariable Long ticketId,
                                     @Valid @RequestBody TransitionRequest request) {
        return TicketResponse.from(
                ticketService.transition(ticketId, request.trigger(), Actor.of(request.actor()))
        );
    }

    /**
     * 다음 단계로 한 번에 넘기기 (단말의 bump 버튼)
     */
    @PostMapping("/{ticketId}/advance")
    public TicketResponse advance(@PathVariable Long ticketId,
                                  @Valid @RequestBody AdvanceRequest request) {
        return TicketResponse.from(ticketService.advance(ticketId, Actor.of(request.actor())));
    }

    @PatchMapping("/{ticketId}/priority")
    public TicketResponse changePriority(@PathVariable Long ticketId,
                                         @Valid @RequestBody ChangePriorityRequest request) {
        return TicketResponse.from(
                ticketService.changePriority(ticketId, request.priority(), Actor.of(request.actor()))
        );
    }
}
