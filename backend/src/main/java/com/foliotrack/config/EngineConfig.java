package com.foliotrack.config;

import com.foliotrack.common.EngineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Engine properties and the clock that decides "today" for time series.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public Clock engineClock(EngineProperties engineProperties) {
        return Clock.system(ZoneId.of(engineProperties.getZoneId()));
    }
}
