package com.postqueue.scheduler.staging;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Object storage REST endpoint (Supabase storage API layout).
 */
@Data
@ConfigurationProperties(prefix = "staging")
public class StagingProperties {

    private String url = "http://localhost:54321";

    /** Service key, sent as a bearer token. */
    private String key;

    private String bucket = "ready_to_publish";

    /** Timeout of one blob transfer. */
    private Duration timeout = Duration.ofMinutes(5);
}
