package com.flagship.payment_settlement.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Business clock. Reference date segments, invoice due dates and quiet hours are all
 * evaluated in the tenant-facing zone rather than the server zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock businessClock(@Value("${settlement.timezone:Africa/Nairobi}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
