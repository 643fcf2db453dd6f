package com.clinic.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The clinic clock. Every "now" and every local date in the booking rules is read
 * from this bean, in the clinic's time zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clinicClock(@Value("${clinic.time-zone:Asia/Tokyo}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
