package com.len.kitchen.common.exception;

import lombok.Getter;

@Getter
public class RoutingException extends BusinessException {

    private final String orderLineId;
    private final String stationId;

    public RoutingException(ErrorCode errorCode, String orderLineId, String stationId) {
        super(errorCode, errorCode.getMessage() + " lineId=" + orderLineId + ", stationId=" + stationId);
        this.orderLineId = orderLineId;
        this.stationId = stationId;
    }
}
