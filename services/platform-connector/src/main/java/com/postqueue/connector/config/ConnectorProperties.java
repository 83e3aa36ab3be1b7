package com.postqueue.connector.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Endpoints, retry and polling budgets for the platform protocol drivers.
 */
@Data
@ConfigurationProperties(prefix = "connector")
public class ConnectorProperties {

    /** Budget for transient failures of a single remote call. */
    private Retry retry = new Retry(3, Duration.ofSeconds(2), Duration.ofSeconds(30));

    /** Timeout of one request/response exchange. */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Timeout of one binary transfer (the whole reel, or one chunk). */
    private Duration uploadTimeout = Duration.ofMinutes(5);

    private Instagram instagram = new Instagram();

    private Twitter twitter = new Twitter();

    @Data
    public static class Instagram {
        private String graphApiUrl = "https://graph.facebook.com/v22.0";
        private String ruploadUrl = "https://rupload.facebook.com/ig-api-upload";
        private Poll processing = new Poll(Duration.ofSeconds(5), 120, Duration.ofMinutes(10));
        /** Publishing right after FINISHED may report "not ready"; retried on this budget. */
        private Retry publish = new Retry(3, Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    @Data
    public static class Twitter {
        private String apiUrl = "https://api.twitter.com/2";
        private String mediaUploadUrl = "https://upload.twitter.com/1.1/media/upload.json";
        private int chunkSize = 4 * 1024 * 1024;
        /** Post creation is not idempotent: a timed out request is never repeated on this budget. */
        private Retry post = new Retry(2, Duration.ofSeconds(5), Duration.ofSeconds(30));
        private Poll processing = new Poll(Duration.ofSeconds(5), 120, Duration.ofMinutes(10));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Retry {
        /** Total attempts including the first one. */
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Poll {
        private Duration interval = Duration.ofSeconds(5);
        private int maxAttempts = 120;
        /** Overall deadline of the poll loop, including hung status calls. */
        private Duration maxWait = Duration.ofMinutes(10);
    }
}
