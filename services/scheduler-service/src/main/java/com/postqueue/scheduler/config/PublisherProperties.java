package com.postqueue.scheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "publisher")
public class PublisherProperties {

    /** Whether the periodic trigger runs at all; manual runs stay available. */
    private boolean enabled = true;

    private String cron = "0 0 * * * *";

    /** Accounts published concurrently within one run. Posts of one account are always sequential. */
    private int maxConcurrentAccounts = 4;

    /** Media upload pipelines in flight at once across all accounts. */
    private int maxConcurrentUploads = 2;
}
