package com.len.kitchen.api.history.dto;

import com.len.kitchen.domain.audit.AuditEntry;
import org.springframework.data.domain.Slice;

import java.util.List;

public record HistoryPageResponse(
        int page,
        int size,
        boolean hasNext,
        List<AuditEntryResponse> entries
) {
    public static HistoryPageResponse from(Slice<AuditEntry> page) {
        return new HistoryPageResponse(
                page.getNumber(),
                page.getSize(),
                page.hasNext(),
                page.getContent().stream().map(AuditEntryResponse::from).toList()
        );
    }
}
