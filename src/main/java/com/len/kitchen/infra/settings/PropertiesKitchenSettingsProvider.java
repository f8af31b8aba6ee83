package com.len.kitchen.infra.settings;

import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.settings.KitchenSettingsProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PropertiesKitchenSettingsProvider implements KitchenSettingsProvider {

    private final KitchenProperties properties;

    @Override
    public KitchenSettings settingsFor(String hubId) {
        KitchenProperties.Hub hub = properties.getHubs().get(hubId);
        if (hub == null || hub.getSettings() == null) {
            return KitchenSettings.defaults();
        }
        return hub.getSettings().toSettings();
    }
}
