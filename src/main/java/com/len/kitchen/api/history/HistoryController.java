package com.len.kitchen.api.history;

import com.len.kitchen.api.history.dto.HistoryPageResponse;
import com.len.kitchen.application.audit.AuditFilter;
import com.len.kitchen.application.ticket.TicketQueryService;
import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.domain.audit.AuditAction;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/kitchen/hubs/{hubId}/history")
public class HistoryController {

    private final TicketQueryService ticketQueryService;

    /**
     * 이력 조회 (occurredAt 오름차순)
     * GET /api/kitchen/hubs/hub-1/history?ticketId=1&action=bumped&from=2026-01-01T00:00:00
     */
    @GetMapping
    public HistoryPageResponse history(
            @PathVariable String hubId,
            @RequestParam(required = false) Long ticketId,
            @RequestParam(required = false) String orderId,
            @RequestParam(required = false) String stationId,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size
    ) {
        AuditFilter filter = new AuditFilter(hubId, ticketId, orderId, stationId, actor, parseAction(action), from, to);
        return HistoryPageResponse.from(ticketQueryService.listHistory(filter, page, size));
    }

    private static AuditAction parseAction(String raw) {
        try {
            return AuditAction.fromWireName(raw);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "알 수 없는 action 입니다. action=" + raw);
        }
    }
}
