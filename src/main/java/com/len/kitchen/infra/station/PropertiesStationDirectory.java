package com.len.kitchen.infra.station;

import com.len.kitchen.domain.station.Station;
import com.len.kitchen.domain.station.StationDirectory;
import com.len.kitchen.infra.settings.KitchenProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 설정 파일 기반 스테이션 조회. 주문 시스템의 스테이션 정의를 그대로 옮겨 둔 것.
 */
@Component
@RequiredArgsConstructor
public class PropertiesStationDirectory implements StationDirectory {

    private final KitchenProperties properties;

    @Override
    public Optional<Station> findStation(String hubId, String stationId) {
        if (hubId == null || stationId == null) {
            return Optional.empty();
        }
        KitchenProperties.Hub hub = properties.getHubs().get(hubId);
        if (hub == null) {
            return Optional.empty();
        }
        KitchenProperties.StationEntry entry = hub.getStations().get(stationId);
        if (entry == null) {
            return Optional.empty();
        }
        String name = entry.getName() != null ? entry.getName() : stationId;
        return Optional.of(new Station(hubId, stationId, name, entry.isActive()));
    }
}
