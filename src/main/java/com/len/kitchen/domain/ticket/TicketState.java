package com.len.kitchen.domain.ticket;

public enum TicketState {
    RECEIVED,     // 주문 접수, 주방 확인 전
    ACCEPTED,     // 주방에서 확인
    IN_PROGRESS,  // 조리 중
    BUMPED,       // 조리 완료, 픽업 대기 (ready queue)
    COMPLETED,    // 픽업 완료
    SERVED,       // 서빙 완료 (종료)
    CANCELLED;    // 취소 (종료)

    public boolean isTerminal() {
        return this == SERVED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == RECEIVED || this == ACCEPTED || this == IN_PROGRESS;
    }
}
