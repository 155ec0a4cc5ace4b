package com.schoolhub.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Single clock source for "today" and creation timestamps. Blank zone means the JVM's local zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${app.clock.zone:}") String zone) {
        if (!StringUtils.hasText(zone)) {
            return Clock.systemDefaultZone();
        }
        return Clock.system(ZoneId.of(zone.trim()));
    }
}
