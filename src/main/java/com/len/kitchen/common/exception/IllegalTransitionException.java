package com.len.kitchen.common.exception;

import lombok.Getter;

/**
 * 현재 상태에서 요청한 트리거를 적용할 수 없을 때.
 * 호출자에게 항상 그대로 전달된다(조용히 무시하지 않음).
 */
@Getter
public class IllegalTransitionException extends BusinessException {

    private final Long ticketId;
    private final String currentState;
    private final String trigger;

    public IllegalTransitionException(Long ticketId, String currentState, String trigger) {
        super(ErrorCode.ILLEGAL_TRANSITION,
                "허용되지 않는 상태 전이입니다. ticketId=" + ticketId + ", state=" + currentState + ", trigger=" + trigger);
        this.ticketId = ticketId;
        this.currentState = currentState;
        this.trigger = trigger;
    }
}
