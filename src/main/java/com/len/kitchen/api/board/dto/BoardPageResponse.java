package com.len.kitchen.api.board.dto;

import com.len.kitchen.api.ticket.dto.TicketResponse;
import com.len.kitchen.application.ticket.TicketView;
import org.springframework.data.domain.Page;

import java.util.List;

public record BoardPageResponse(
        int page,
        int size,
        long totalElements,
        int totalPages,
        List<TicketResponse> tickets
) {
    public static BoardPageResponse from(Page<TicketView> page) {
        return new BoardPageResponse(
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.getContent().stream().map(TicketResponse::from).toList()
        );
    }
}
