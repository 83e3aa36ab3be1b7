package com.postqueue.scheduler.service;

import com.postqueue.connector.SocialMediaConnector;
import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.AccountCredentialsProvider;
import com.postqueue.connector.credentials.TwitterCredentials;
import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.model.Platform;
import com.postqueue.connector.twitter.*;
import com.postqueue.scheduler.config.PublisherProperties;
import com.postqueue.scheduler.dto.PublishRunSummary;
import com.postqueue.scheduler.entity.ScheduledPost;
import com.postqueue.scheduler.staging.BlobStaging;
import com.postqueue.scheduler.staging.InMemoryBlobStaging;
import com.postqueue.scheduler.staging.ObjectStorageBlobStaging;
import com.postqueue.scheduler.staging.StagingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class PublisherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T06:00:00Z"), ZoneOffset.UTC);
    private static final OffsetDateTime DUE = OffsetDateTime.parse("2024-03-10T09:00:00+05:30");

    private ScheduleStore store;
    private InMemoryBlobStaging blobStaging;
    private PublisherProperties properties;

    @BeforeEach
    void setUp() {
        store = mock(ScheduleStore.class);
        blobStaging = new InMemoryBlobStaging();
        properties = new PublisherProperties();
        properties.setMaxConcurrentAccounts(4);
        properties.setMaxConcurrentUploads(2);
        when(store.claim(any())).thenReturn(true);
    }

    // ==================== End to end through real connectors ====================

    @Test
    void textPostPublishesWithoutAnyUploadProtocol() {
        ScheduledPost post = post(Platform.TEXT_ONLY, "acct-a", null, "hello", 0);
        when(store.queryDue(any())).thenReturn(List.of(post));

        AccountCredentialsProvider credentials = twitterCredentials();
        TextPostApi textPostApi = mock(TextPostApi.class);
        ChunkedUploadApi uploadApi = mock(ChunkedUploadApi.class);
        when(textPostApi.postText(any(), eq("hello"), eq(List.of()), isNull())).thenReturn(Mono.just("1799"));
        ConnectorProperties connectorProperties = fastConnectorProperties();

        Publisher publisher = publisher(
                new TwitterTextConnectorService(credentials, textPostApi, connectorProperties),
                new TwitterVideoConnectorService(credentials,
                        new ChunkedMultipartUpload(uploadApi, connectorProperties), textPostApi, connectorProperties));

        PublishRunSummary summary = publisher.run();

        assertEquals(new PublishRunSummary(1, 1, 0, 0), summary);
        InOrder inOrder = inOrder(store);
        inOrder.verify(store).claim(post.getId());
        inOrder.verify(store).markPosted(eq(post.getId()), any(), eq("1799"), eq("https://x.com/i/web/status/1799"));
        verify(store, never()).markFailed(any(), any());
        verifyNoInteractions(uploadApi);
    }

    @Test
    void replyIsPublishedUnderItsParentPost() {
        ScheduledPost reply = post(Platform.TEXT_ONLY, "acct-a", null, "part 2", 0);
        reply.setReplyToPostId("1799");
        when(store.queryDue(any())).thenReturn(List.of(reply));

        TextPostApi textPostApi = mock(TextPostApi.class);
        when(textPostApi.postText(any(), eq("part 2"), eq(List.of()), eq("1799"))).thenReturn(Mono.just("1800"));

        PublishRunSummary summary = publisher(new TwitterTextConnectorService(
                twitterCredentials(), textPostApi, fastConnectorProperties())).run();

        assertEquals(new PublishRunSummary(1, 1, 0, 0), summary);
        verify(store).markPosted(eq(reply.getId()), any(), eq("1800"), eq("https://x.com/i/web/status/1800"));
    }

    @Test
    void mediaProcessingThatNeverFinishesFailsWithTimeoutAndDropsTheBlob() {
        String ref = blobStaging.put(new byte[]{1, 2, 3, 4, 5}, "video/mp4");
        ScheduledPost post = post(Platform.VIDEO_ATTACHED, "acct-a", ref, "clip", 0);
        when(store.queryDue(any())).thenReturn(List.of(post));

        NeverFinishingUploadApi uploadApi = new NeverFinishingUploadApi();
        TextPostApi textPostApi = mock(TextPostApi.class);
        ConnectorProperties connectorProperties = fastConnectorProperties();
        connectorProperties.getTwitter().setProcessing(
                new ConnectorProperties.Poll(Duration.ofMillis(1), 120, Duration.ofSeconds(30)));

        Publisher publisher = publisher(new TwitterVideoConnectorService(twitterCredentials(),
                new ChunkedMultipartUpload(uploadApi, connectorProperties), textPostApi, connectorProperties));

        PublishRunSummary summary = publisher.run();

        assertEquals(new PublishRunSummary(1, 0, 1, 0), summary);
        assertEquals(120, uploadApi.statusPolls.get());
        verify(store).markFailed(eq(post.getId()), startsWith("[TIMEOUT]"));
        verify(store, never()).markPosted(any(), any(), any(), any());
        verifyNoInteractions(textPostApi);
        assertFalse(blobStaging.contains(ref));
    }

    // ==================== Per post isolation ====================

    @Test
    void failureOfOnePostDoesNotStopTheRun() {
        ScheduledPost first = post(Platform.TEXT_ONLY, "acct-a", null, "one", 0);
        ScheduledPost second = post(Platform.TEXT_ONLY, "acct-a", null, "two", 1);
        when(store.queryDue(any())).thenReturn(List.of(first, second));

        SocialMediaConnector text = connector(Platform.TEXT_ONLY);
        when(text.publish(any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(PublishResult.success(Platform.TEXT_ONLY, "2", "2", "https://x.com/i/web/status/2"));

        PublishRunSummary summary = publisher(text).run();

        assertEquals(new PublishRunSummary(2, 1, 1, 0), summary);
        verify(store).markFailed(first.getId(), "[INTERNAL_ERROR] boom");
        verify(store).markPosted(eq(second.getId()), any(), eq("2"), any());
    }

    @Test
    void failedResultIsStoredAndBlobDeleted() {
        String ref = blobStaging.put(new byte[]{9, 9}, "video/mp4");
        ScheduledPost reel = post(Platform.INSTAGRAM, "acct-a", ref, "reel", 0);
        when(store.queryDue(any())).thenReturn(List.of(reel));

        SocialMediaConnector instagram = connector(Platform.INSTAGRAM);
        when(instagram.publish(any()))
                .thenReturn(PublishResult.failure(Platform.INSTAGRAM, "PROTOCOL_ERROR", "media rejected"));

        publisher(instagram).run();

        verify(store).markFailed(reel.getId(), "[PROTOCOL_ERROR] media rejected");
        assertFalse(blobStaging.contains(ref));
    }

    @Test
    void successfulMediaPostHandsPayloadToConnectorAndDeletesBlob() {
        byte[] payload = {1, 2, 3};
        String ref = blobStaging.put(payload, "video/mp4");
        ScheduledPost reel = post(Platform.INSTAGRAM, "acct-a", ref, "reel", 0);
        when(store.queryDue(any())).thenReturn(List.of(reel));

        SocialMediaConnector instagram = connector(Platform.INSTAGRAM);
        when(instagram.publish(any())).thenAnswer(invocation -> {
            PublishRequest request = invocation.getArgument(0);
            assertArrayEquals(payload, request.getMedia());
            assertEquals("video/mp4", request.getMediaContentType());
            assertEquals("reel", request.getCaption());
            return PublishResult.success(Platform.INSTAGRAM, "c-1", "m-1", "https://www.instagram.com/reel/abc/");
        });

        PublishRunSummary summary = publisher(instagram).run();

        assertEquals(1, summary.getPublished());
        verify(store).markPosted(eq(reel.getId()), any(), eq("m-1"), eq("https://www.instagram.com/reel/abc/"));
        assertFalse(blobStaging.contains(ref));
    }

    @Test
    void unreachableStagingDuringCleanupKeepsThePostPublished() {
        String ref = "https://project.supabase.co/storage/v1/object/public/ready_to_publish/abc.mp4";
        WebClient.Builder storage = WebClient.builder().exchangeFunction(request -> {
            if (request.method() == HttpMethod.DELETE) {
                return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                        request.method(), request.url(), request.headers()));
            }
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, "video/mp4")
                    .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(new byte[]{1, 2, 3})))
                    .build());
        });
        StagingProperties stagingProperties = new StagingProperties();
        stagingProperties.setUrl("https://project.supabase.co");
        stagingProperties.setKey("service-key");

        ScheduledPost reel = post(Platform.INSTAGRAM, "acct-a", ref, "reel", 0);
        when(store.queryDue(any())).thenReturn(List.of(reel));
        SocialMediaConnector instagram = connector(Platform.INSTAGRAM);
        when(instagram.publish(any()))
                .thenReturn(PublishResult.success(Platform.INSTAGRAM, "c-1", "m-1", "https://www.instagram.com/reel/abc/"));

        PublishRunSummary summary = publisher(new ObjectStorageBlobStaging(storage, stagingProperties), instagram).run();

        assertEquals(new PublishRunSummary(1, 1, 0, 0), summary);
        verify(store).markPosted(eq(reel.getId()), any(), eq("m-1"), eq("https://www.instagram.com/reel/abc/"));
        verify(store, never()).markFailed(any(), any());
    }

    @Test
    void missingBlobFailsThePostWithoutCallingTheConnector() {
        ScheduledPost reel = post(Platform.INSTAGRAM, "acct-a", "memory://ready_to_publish/gone", "reel", 0);
        when(store.queryDue(any())).thenReturn(List.of(reel));
        SocialMediaConnector instagram = connector(Platform.INSTAGRAM);

        publisher(instagram).run();

        verify(store).markFailed(eq(reel.getId()), startsWith("[MEDIA_UNAVAILABLE]"));
        verify(instagram, never()).publish(any());
    }

    @Test
    void platformWithoutConnectorFails() {
        ScheduledPost post = post(Platform.TEXT_ONLY, "acct-a", null, "hello", 0);
        when(store.queryDue(any())).thenReturn(List.of(post));

        publisher(connector(Platform.INSTAGRAM)).run();

        verify(store).markFailed(eq(post.getId()), startsWith("[UNSUPPORTED_PLATFORM]"));
    }

    // ==================== Claims and store failures ====================

    @Test
    void postClaimedElsewhereIsSkipped() {
        ScheduledPost taken = post(Platform.TEXT_ONLY, "acct-a", null, "one", 0);
        ScheduledPost free = post(Platform.TEXT_ONLY, "acct-a", null, "two", 1);
        when(store.queryDue(any())).thenReturn(List.of(taken, free));
        when(store.claim(taken.getId())).thenReturn(false);

        SocialMediaConnector text = connector(Platform.TEXT_ONLY);
        when(text.publish(any())).thenReturn(PublishResult.success(Platform.TEXT_ONLY, "2", "2", null));

        PublishRunSummary summary = publisher(text).run();

        assertEquals(new PublishRunSummary(2, 1, 0, 1), summary);
        verify(text, times(1)).publish(any());
        verify(store, never()).markPosted(eq(taken.getId()), any(), any(), any());
        verify(store, never()).markFailed(eq(taken.getId()), any());
    }

    @Test
    void unreachableStoreAbortsTheRun() {
        ScheduledPost post = post(Platform.TEXT_ONLY, "acct-a", null, "hello", 0);
        when(store.queryDue(any())).thenReturn(List.of(post));
        when(store.claim(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));
        SocialMediaConnector text = connector(Platform.TEXT_ONLY);

        Publisher publisher = publisher(text);

        assertThrows(DataAccessException.class, publisher::run);
        verify(text, never()).publish(any());
    }

    @Test
    void nothingDueIsAnEmptyRun() {
        when(store.queryDue(any())).thenReturn(List.of());

        assertEquals(PublishRunSummary.empty(), publisher(connector(Platform.TEXT_ONLY)).run());
        verify(store).queryDue(OffsetDateTime.now(CLOCK));
        verify(store, never()).claim(any());
    }

    // ==================== Concurrency bounds ====================

    @Test
    void postsOfOneAccountRunSequentiallyInScheduledOrder() {
        List<ScheduledPost> due = new ArrayList<>();
        for (int slot = 0; slot < 4; slot++) {
            for (String account : List.of("acct-a", "acct-b", "acct-c")) {
                due.add(post(Platform.TEXT_ONLY, account, null, account + "-" + slot, slot));
            }
        }
        when(store.queryDue(any())).thenReturn(due);
        RecordingConnector text = new RecordingConnector(Platform.TEXT_ONLY, Duration.ofMillis(20));

        PublishRunSummary summary = publisher(text).run();

        assertEquals(12, summary.getPublished());
        for (String account : List.of("acct-a", "acct-b", "acct-c")) {
            assertEquals(List.of(account + "-0", account + "-1", account + "-2", account + "-3"),
                    text.captionsByAccount.get(account));
            assertEquals(1, text.maxInFlightPerAccount.get(account).get());
        }
    }

    @Test
    void simultaneousUploadsAreCapped() {
        properties.setMaxConcurrentUploads(1);
        List<ScheduledPost> due = new ArrayList<>();
        for (String account : List.of("acct-a", "acct-b", "acct-c")) {
            String ref = blobStaging.put(new byte[]{1}, "video/mp4");
            due.add(post(Platform.INSTAGRAM, account, ref, "reel", 0));
        }
        when(store.queryDue(any())).thenReturn(due);
        RecordingConnector instagram = new RecordingConnector(Platform.INSTAGRAM, Duration.ofMillis(50));

        PublishRunSummary summary = publisher(instagram).run();

        assertEquals(3, summary.getPublished());
        assertEquals(1, instagram.maxInFlight.get());
    }

    // ==================== Fixtures ====================

    private Publisher publisher(SocialMediaConnector... connectors) {
        return publisher(blobStaging, connectors);
    }

    private Publisher publisher(BlobStaging staging, SocialMediaConnector... connectors) {
        return new Publisher(store, staging, List.of(connectors), properties, CLOCK);
    }

    private static SocialMediaConnector connector(Platform platform) {
        SocialMediaConnector connector = mock(SocialMediaConnector.class);
        when(connector.getPlatform()).thenReturn(platform);
        return connector;
    }

    private static ScheduledPost post(Platform platform, String accountRef, String mediaRef, String caption, int slot) {
        return ScheduledPost.builder()
                .id(UUID.randomUUID())
                .platform(platform)
                .accountRef(accountRef)
                .mediaRef(mediaRef)
                .caption(caption)
                .scheduledTime(DUE.plusDays(slot))
                .build();
    }

    private static AccountCredentialsProvider twitterCredentials() {
        AccountCredentialsProvider credentials = mock(AccountCredentialsProvider.class);
        when(credentials.twitter(any())).thenAnswer(invocation ->
                new TwitterCredentials(invocation.getArgument(0), "token"));
        return credentials;
    }

    private static ConnectorProperties fastConnectorProperties() {
        ConnectorProperties connectorProperties = new ConnectorProperties();
        connectorProperties.setRetry(new ConnectorProperties.Retry(3, Duration.ofMillis(1), Duration.ofMillis(5)));
        connectorProperties.getTwitter().setPost(new ConnectorProperties.Retry(2, Duration.ofMillis(1), Duration.ofMillis(5)));
        connectorProperties.setRequestTimeout(Duration.ofSeconds(5));
        connectorProperties.setUploadTimeout(Duration.ofSeconds(5));
        return connectorProperties;
    }

    /**
     * Accepts every chunk, then reports IN_PROGRESS forever
     */
    private static class NeverFinishingUploadApi implements ChunkedUploadApi {
        private final AtomicInteger statusPolls = new AtomicInteger();

        @Override
        public Mono<String> init(TwitterCredentials account, long totalBytes, String mediaType, String mediaCategory) {
            return Mono.just("media-1");
        }

        @Override
        public Mono<Void> appendChunk(TwitterCredentials account, String mediaId, int segmentIndex, byte[] chunk) {
            return Mono.empty();
        }

        @Override
        public Mono<MediaStatus> finalizeUpload(TwitterCredentials account, String mediaId) {
            return Mono.just(new MediaStatus(mediaId, MediaProcessingState.PENDING, 5, null));
        }

        @Override
        public Mono<MediaStatus> pollStatus(TwitterCredentials account, String mediaId) {
            return Mono.fromSupplier(() -> {
                statusPolls.incrementAndGet();
                return new MediaStatus(mediaId, MediaProcessingState.IN_PROGRESS, 5, null);
            });
        }
    }

    /**
     * Records call order and concurrency, then succeeds after a short pause
     */
    private static class RecordingConnector implements SocialMediaConnector {
        private final Platform platform;
        private final Duration pause;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final Map<String, AtomicInteger> inFlightPerAccount = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> maxInFlightPerAccount = new ConcurrentHashMap<>();
        private final Map<String, List<String>> captionsByAccount = new ConcurrentHashMap<>();

        RecordingConnector(Platform platform, Duration pause) {
            this.platform = platform;
            this.pause = pause;
        }

        @Override
        public Platform getPlatform() {
            return platform;
        }

        @Override
        public PublishResult publish(PublishRequest request) {
            String account = request.getAccountRef();
            captionsByAccount.computeIfAbsent(account, a -> Collections.synchronizedList(new ArrayList<>()))
                    .add(request.getCaption());
            AtomicInteger accountInFlight = inFlightPerAccount.computeIfAbsent(account, a -> new AtomicInteger());
            enter(accountInFlight, maxInFlightPerAccount.computeIfAbsent(account, a -> new AtomicInteger()));
            enter(inFlight, maxInFlight);
            try {
                Thread.sleep(pause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
                accountInFlight.decrementAndGet();
            }
            return PublishResult.success(platform, request.getCaption(), request.getCaption(), null);
        }

        private static void enter(AtomicInteger counter, AtomicInteger max) {
            max.accumulateAndGet(counter.incrementAndGet(), Math::max);
        }
    }
}
