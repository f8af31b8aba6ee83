package com.len.kitchen.domain.station;

import java.util.Optional;

public interface StationDirectory {

    Optional<Station> findStation(String hubId, String stationId);
}
