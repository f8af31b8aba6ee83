package com.len.kitchen.domain.settings;

public interface KitchenSettingsProvider {

    /**
     * 등록되지 않은 허브는 기본값.
     */
    KitchenSettings settingsFor(String hubId);
}
