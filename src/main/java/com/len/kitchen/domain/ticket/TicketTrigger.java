package com.len.kitchen.domain.ticket;

import com.len.kitchen.domain.audit.AuditAction;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TicketTrigger {
    ACCEPT(AuditAction.ACCEPTED),
    START(AuditAction.STARTED),
    BUMP(AuditAction.BUMPED),
    COMPLETE(AuditAction.COMPLETED),
    SERVE(AuditAction.SERVED),
    CANCEL(AuditAction.CANCELLED),
    RECALL(AuditAction.RECALLED);

    private final AuditAction auditAction;
}
