package com.len.kitchen.domain.settings;

/**
 * 허브별 주방 디스플레이 설정 (읽기 전용).
 * 임계값이 0 이하이면 해당 단계 분류를 끈다.
 */
public record KitchenSettings(
        long warningThresholdSeconds,
        long criticalThresholdSeconds,
        boolean autoBumpEnabled,
        long autoBumpDelaySeconds,
        long autoBumpIntervalSeconds,
        boolean autoAcceptEnabled,
        int itemsPerPage,
        int refreshIntervalSeconds,
        boolean showTimer,
        boolean soundEnabled,
        boolean soundOnNewOrder,
        boolean soundOnRush,
        boolean colorCodingEnabled
) {
    public static KitchenSettings defaults() {
        return new KitchenSettings(
                15 * 60,
                30 * 60,
                false,
                300,
                5,
                false,
                12,
                10,
                true,
                true,
                true,
                true,
                true
        );
    }
}
