package com.len.kitchen.domain.order;

public record OrderLine(
        String lineId,
        String itemName,
        int quantity,
        String stationId,   // 메뉴/스테이션 매핑은 주문 시스템에서 해석해서 넘겨줌
        String notes
) {}
