package com.len.kitchen.infra.settings;

import com.len.kitchen.domain.settings.KitchenSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * kitchen.hubs.{hubId}.settings / kitchen.hubs.{hubId}.stations.{stationId} 바인딩.
 * 설정 저장/변경은 이 서비스의 책임이 아니라서 읽기만 한다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kitchen")
public class KitchenProperties {

    private Map<String, Hub> hubs = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Hub {
        private HubSettings settings = new HubSettings();
        private Map<String, StationEntry> stations = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class HubSettings {
        private long warningThresholdSeconds = 15 * 60;
        private long criticalThresholdSeconds = 30 * 60;
        private boolean autoBumpEnabled = false;
        private long autoBumpDelaySeconds = 300;
        private long autoBumpIntervalSeconds = 5;
        private boolean autoAcceptEnabled = false;
        private int itemsPerPage = 12;
        private int refreshIntervalSeconds = 10;
        private boolean showTimer = true;
        private boolean soundEnabled = true;
        private boolean soundOnNewOrder = true;
        private boolean soundOnRush = true;
        private boolean colorCodingEnabled = true;

        public KitchenSettings toSettings() {
            return new KitchenSettings(
                    warningThresholdSeconds,
                    criticalThresholdSeconds,
                    autoBumpEnabled,
                    autoBumpDelaySeconds,
                    autoBumpIntervalSeconds,
                    autoAcceptEnabled,
                    itemsPerPage,
                    refreshIntervalSeconds,
                    showTimer,
                    soundEnabled,
                    soundOnNewOrder,
                    soundOnRush,
                    colorCodingEnabled
            );
        }
    }

    @Getter
    @Setter
    public static class StationEntry {
        private String name;
        private boolean active = true;
    }
}
