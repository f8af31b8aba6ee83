package com.len.kitchen.application.ticket;

import com.len.kitchen.application.timer.TicketTiming;
import com.len.kitchen.domain.ticket.Ticket;

public record TicketView(Ticket ticket, TicketTiming timing) {}
