package com.postqueue.scheduler.service;

import com.postqueue.connector.SocialMediaConnector;
import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.model.Platform;
import com.postqueue.scheduler.config.PublisherProperties;
import com.postqueue.scheduler.dto.PublishRunSummary;
import com.postqueue.scheduler.entity.ScheduledPost;
import com.postqueue.scheduler.staging.BlobStaging;
import com.postqueue.scheduler.staging.BlobStagingException;
import com.postqueue.scheduler.staging.StagedMedia;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * One invocation of {@link #run()} publishes every post due at that moment.
 * <p>
 * Accounts are processed concurrently up to a configured bound, the posts of one account strictly
 * one after another in scheduled order. Each post is claimed first, so overlapping runs never
 * publish the same post twice. A failing post never stops the run; only losing the store does.
 */
@Service
@Slf4j
public class Publisher {

    private final ScheduleStore scheduleStore;
    private final BlobStaging blobStaging;
    private final PublisherProperties properties;
    private final Clock clock;
    private final Map<Platform, SocialMediaConnector> connectors = new EnumMap<>(Platform.class);
    private final Semaphore uploadPermits;

    public Publisher(ScheduleStore scheduleStore, BlobStaging blobStaging, List<SocialMediaConnector> connectors,
                     PublisherProperties properties, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.blobStaging = blobStaging;
        this.properties = properties;
        this.clock = clock;
        this.uploadPermits = new Semaphore(Math.max(1, properties.getMaxConcurrentUploads()), true);
        for (SocialMediaConnector connector : connectors) {
            this.connectors.put(connector.getPlatform(), connector);
        }
        log.info("Publisher ready for platforms {}", this.connectors.keySet());
    }

    public PublishRunSummary run() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<ScheduledPost> due = scheduleStore.queryDue(now);
        if (due.isEmpty()) {
            log.debug("No posts due at {}", now);
            return PublishRunSummary.empty();
        }

        Map<String, List<ScheduledPost>> byAccount = due.stream()
                .collect(Collectors.groupingBy(ScheduledPost::getAccountRef, LinkedHashMap::new, Collectors.toList()));
        log.info("Publisher run at {}: {} due posts across {} accounts", now, due.size(), byAccount.size());

        RunTally tally = new RunTally();
        Flux.fromIterable(byAccount.entrySet())
                .flatMap(entry -> Mono.fromRunnable(() -> publishAccount(entry.getKey(), entry.getValue(), tally))
                                .subscribeOn(Schedulers.boundedElastic()),
                        Math.max(1, properties.getMaxConcurrentAccounts()))
                .then()
                .block();

        PublishRunSummary summary = tally.summary(due.size());
        log.info("Publisher run finished: {}", summary);
        return summary;
    }

    private void publishAccount(String accountRef, List<ScheduledPost> posts, RunTally tally) {
        log.debug("Publishing {} posts for account {}", posts.size(), accountRef);
        for (ScheduledPost post : posts) {
            try {
                publishOne(post, tally);
            } catch (DataAccessException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error finishing post {}: {}", post.getId(), e.getMessage(), e);
                tally.failed.incrementAndGet();
            }
        }
    }

    private void publishOne(ScheduledPost post, RunTally tally) {
        if (!scheduleStore.claim(post.getId())) {
            tally.skipped.incrementAndGet();
            return;
        }

        PublishResult result;
        try {
            result = dispatch(post);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error publishing post {}: {}", post.getId(), e.getMessage(), e);
            result = PublishResult.failure(post.getPlatform(), "INTERNAL_ERROR", e.getMessage());
        }

        if (result.isSuccess()) {
            scheduleStore.markPosted(post.getId(), OffsetDateTime.now(clock),
                    result.getPlatformPostId(), result.getShareUrl());
            tally.published.incrementAndGet();
        } else {
            scheduleStore.markFailed(post.getId(), result.describeFailure());
            tally.failed.incrementAndGet();
        }

        discardBlob(post);
    }

    private PublishResult dispatch(ScheduledPost post) {
        SocialMediaConnector connector = connectors.get(post.getPlatform());
        if (connector == null) {
            return PublishResult.failure(post.getPlatform(), "UNSUPPORTED_PLATFORM",
                    "No connector registered for " + post.getPlatform());
        }

        if (!post.getPlatform().isRequiresMedia()) {
            return connector.publish(request(post, null));
        }

        try {
            uploadPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PublishResult.failure(post.getPlatform(), "INTERRUPTED", "Interrupted while waiting for an upload slot");
        }
        try {
            StagedMedia media;
            try {
                media = blobStaging.get(post.getMediaRef());
            } catch (BlobStagingException e) {
                return PublishResult.failure(post.getPlatform(), "MEDIA_UNAVAILABLE", e.getMessage());
            }
            log.info("Uploading {} bytes for post {} to {}", media.size(), post.getId(), post.getPlatform());
            return connector.publish(request(post, media));
        } finally {
            uploadPermits.release();
        }
    }

    private static PublishRequest request(ScheduledPost post, StagedMedia media) {
        return PublishRequest.builder()
                .postId(post.getId())
                .platform(post.getPlatform())
                .accountRef(post.getAccountRef())
                .caption(post.getCaption())
                .replyToPostId(post.getReplyToPostId())
                .media(media != null ? media.getContent() : null)
                .mediaContentType(media != null ? media.getContentType() : null)
                .build();
    }

    private void discardBlob(ScheduledPost post) {
        if (!post.hasMedia()) {
            return;
        }
        try {
            blobStaging.delete(post.getMediaRef());
        } catch (BlobStagingException e) {
            log.warn("Could not remove staged media {} of post {}: {}", post.getMediaRef(), post.getId(), e.getMessage(), e);
        }
    }

    private static class RunTally {
        private final AtomicInteger published = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();

        PublishRunSummary summary(int due) {
            return new PublishRunSummary(due, published.get(), failed.get(), skipped.get());
        }
    }
}
