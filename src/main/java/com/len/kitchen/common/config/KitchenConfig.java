package com.len.kitchen.common.config;

import com.len.kitchen.infra.settings.KitchenProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(KitchenProperties.class)
public class KitchenConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
