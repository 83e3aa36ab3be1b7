package com.postqueue.scheduler.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic publisher run. Overlap with a manual run is harmless since every post is claimed first.
 */
@Component
@ConditionalOnProperty(prefix = "publisher", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PublishTrigger {

    private final Publisher publisher;

    @Scheduled(cron = "${publisher.cron:0 0 * * * *}")
    public void publishDuePosts() {
        try {
            publisher.run();
        } catch (DataAccessException e) {
            log.error("Publisher run aborted, schedule store unavailable: {}", e.getMessage(), e);
        }
    }
}
