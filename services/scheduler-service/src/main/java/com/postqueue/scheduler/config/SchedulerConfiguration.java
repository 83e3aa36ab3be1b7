package com.postqueue.scheduler.config;

import com.postqueue.scheduler.service.SlotCalculator;
import com.postqueue.scheduler.staging.StagingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({SchedulerProperties.class, PublisherProperties.class, StagingProperties.class})
public class SchedulerConfiguration {

    @Bean
    public SlotCalculator slotCalculator(SchedulerProperties properties) {
        return new SlotCalculator(properties.getSlots().zoneId(), properties.getSlots().localTimes());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
