package com.len.kitchen.domain.ticket;

import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.ErrorCode;

/**
 * 상태 전이를 일으킨 주체. 단말 사용자 id 또는 시스템.
 */
public record Actor(String id) {

    public static final String SYSTEM_ID = "system";

    private static final Actor SYSTEM = new Actor(SYSTEM_ID);

    public Actor {
        if (id == null || id.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "actor는 필수입니다.");
        }
        id = id.trim();
    }

    public static Actor system() {
        return SYSTEM;
    }

    public static Actor of(String id) {
        return new Actor(id);
    }
}
