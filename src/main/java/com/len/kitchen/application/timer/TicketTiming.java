package com.len.kitchen.application.timer;

public record TicketTiming(long elapsedSeconds, EscalationLevel level) {}
