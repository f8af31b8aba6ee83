package com.len.kitchen.domain.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditAction {
    RECEIVED,
    ACCEPTED,
    STARTED,
    BUMPED,
    COMPLETED,
    SERVED,
    RECALLED,
    CANCELLED,
    PRIORITY_CHANGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditAction fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return AuditAction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
