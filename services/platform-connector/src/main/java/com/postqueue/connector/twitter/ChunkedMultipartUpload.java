package com.postqueue.connector.twitter;

import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.TwitterCredentials;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.support.PollDecision;
import com.postqueue.connector.support.RemoteCalls;
import com.postqueue.connector.support.StatusPoller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Drives a media upload through INIT -> APPENDING -> FINALIZING -> PROCESSING -> SUCCEEDED | FAILED.
 * Chunks of one media id are sent strictly in index order, one at a time.
 */
@Component
@Slf4j
public class ChunkedMultipartUpload {

    private final ChunkedUploadApi api;
    private final ConnectorProperties properties;

    public ChunkedMultipartUpload(ChunkedUploadApi api, ConnectorProperties properties) {
        this.api = api;
        this.properties = properties;
    }

    /**
     * @return the media id, ready to be attached to a post
     */
    public String upload(TwitterCredentials account, byte[] payload, String mediaType) {
        Duration requestTimeout = properties.getRequestTimeout();
        String contentType = mediaType != null ? mediaType : "video/mp4";
        String category = contentType.startsWith("video/") ? "tweet_video" : "tweet_image";

        ChunkedUploadState state = ChunkedUploadState.INIT;
        String mediaId = RemoteCalls.call("Media INIT",
                () -> api.init(account, payload.length, contentType, category),
                requestTimeout, properties.getRetry()).block();
        log.info("Initialized media {} ({} bytes, {}) for account {}",
                mediaId, payload.length, category, account.getAccountRef());

        try {
            state = ChunkedUploadState.APPENDING;
            List<byte[]> chunks = split(payload, properties.getTwitter().getChunkSize());
            for (int index = 0; index < chunks.size(); index++) {
                int segmentIndex = index;
                byte[] chunk = chunks.get(index);
                RemoteCalls.call("Media APPEND of segment " + segmentIndex,
                        () -> api.appendChunk(account, mediaId, segmentIndex, chunk),
                        properties.getUploadTimeout(), properties.getRetry()).block();
                log.debug("Appended segment {}/{} of media {}", segmentIndex + 1, chunks.size(), mediaId);
            }

            state = ChunkedUploadState.FINALIZING;
            MediaStatus finalized = RemoteCalls.call("Media FINALIZE",
                    () -> api.finalizeUpload(account, mediaId), requestTimeout, properties.getRetry()).block();

            if (finalized == null || finalized.getState() != MediaProcessingState.SUCCEEDED) {
                state = ChunkedUploadState.PROCESSING;
                log.info("Media {} is processing asynchronously", mediaId);
                StatusPoller.pollUntil("Processing of media " + mediaId,
                        () -> RemoteCalls.call("Media STATUS",
                                () -> api.pollStatus(account, mediaId), requestTimeout, properties.getRetry()),
                        ChunkedMultipartUpload::decide,
                        properties.getTwitter().getProcessing()).block();
            }

            state = ChunkedUploadState.SUCCEEDED;
            log.info("Media {} is ready", mediaId);
            return mediaId;

        } catch (PublishException e) {
            log.error("Upload of media {} failed while {}: {}", mediaId, state, e.getMessage());
            throw e;
        }
    }

    static List<byte[]> split(byte[] payload, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        List<byte[]> chunks = new ArrayList<>();
        for (int offset = 0; offset < payload.length; offset += chunkSize) {
            chunks.add(Arrays.copyOfRange(payload, offset, Math.min(payload.length, offset + chunkSize)));
        }
        return chunks;
    }

    static PollDecision decide(MediaStatus status) {
        return switch (status.getState()) {
            case SUCCEEDED -> PollDecision.done();
            case FAILED -> PollDecision.failed(status.getError() != null ? status.getError() : "unknown error");
            default -> PollDecision.keepPolling();
        };
    }
}
