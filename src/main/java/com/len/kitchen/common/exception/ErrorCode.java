package com.len.kitchen.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다."),
    STORAGE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_FAILURE", "저장소를 사용할 수 없습니다. 잠시 후 다시 시도해주세요."),

    // 티켓 관련
    TICKET_NOT_FOUND(HttpStatus.NOT_FOUND, "TICKET_NOT_FOUND", "티켓이 존재하지 않습니다."),
    ILLEGAL_TRANSITION(HttpStatus.CONFLICT, "ILLEGAL_TRANSITION", "현재 상태에서 허용되지 않는 동작입니다."),

    // 라우팅 관련
    STATION_NOT_FOUND(HttpStatus.UNPROCESSABLE_ENTITY, "STATION_NOT_FOUND", "스테이션이 존재하지 않습니다."),
    STATION_INACTIVE(HttpStatus.UNPROCESSABLE_ENTITY, "STATION_INACTIVE", "비활성화된 스테이션입니다."),
    LINE_ALREADY_ROUTED(HttpStatus.CONFLICT, "LINE_ALREADY_ROUTED", "이미 티켓이 생성된 주문 항목입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
}
