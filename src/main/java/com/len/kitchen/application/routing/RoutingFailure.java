package com.len.kitchen.application.routing;

import com.len.kitchen.common.exception.ErrorCode;
import com.len.kitchen.common.exception.RoutingException;

public record RoutingFailure(
        String orderLineId,
        String stationId,
        ErrorCode errorCode,
        String message
) {
    public static RoutingFailure of(RoutingException e) {
        return new RoutingFailure(e.getOrderLineId(), e.getStationId(), e.getErrorCode(), e.getMessage());
    }
}
