package com.len.kitchen.common.exception;

import lombok.Getter;

@Getter
public class TicketNotFoundException extends BusinessException {

    private final Long ticketId;

    public TicketNotFoundException(Long ticketId) {
        super(ErrorCode.TICKET_NOT_FOUND, "티켓이 존재하지 않습니다. ticketId=" + ticketId);
        this.ticketId = ticketId;
    }
}
