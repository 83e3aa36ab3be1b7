package com.postqueue.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Daily publication slots shared by every account chain.
 */
@Data
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private Slots slots = new Slots();

    @Data
    public static class Slots {
        /** Canonical zone the slot times are expressed in. */
        private String zone = "Asia/Kolkata";
        /** Times of day, HH:mm. */
        private List<String> times = List.of("09:00", "14:00", "19:00");

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }

        public List<LocalTime> localTimes() {
            return times.stream()
                    .map(String::trim)
                    .map(LocalTime::parse)
                    .collect(Collectors.toList());
        }
    }
}
