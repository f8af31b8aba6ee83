package com.len.kitchen.application.audit;

import com.len.kitchen.domain.audit.AuditAction;

import java.time.LocalDateTime;

/**
 * 이력 조회 조건. null인 항목은 조건에서 빠진다. 기간은 [from, to).
 */
public record AuditFilter(
        String hubId,
        Long ticketId,
        String orderId,
        String stationId,
        String actor,
        AuditAction action,
        LocalDateTime from,
        LocalDateTime to
) {
    public static AuditFilter forHub(String hubId) {
        return new AuditFilter(hubId, null, null, null, null, null, null, null);
    }
}
