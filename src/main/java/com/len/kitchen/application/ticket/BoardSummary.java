package com.len.kitchen.application.ticket;

public record BoardSummary(
        String hubId,
        long received,
        long accepted,
        long inProgress,
        long bumped,
        long completed
) {
    public long active() {
        return received + accepted + inProgress;
    }
}
