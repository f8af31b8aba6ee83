package com.len.kitchen.domain.station;

public record Station(
        String hubId,
        String stationId,
        String name,
        boolean active
) {}
