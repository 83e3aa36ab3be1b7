package com.postqueue.connector.instagram;

import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.InstagramCredentials;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.support.PollDecision;
import com.postqueue.connector.support.RemoteCalls;
import com.postqueue.connector.support.StatusPoller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Drives a reel through CREATED -> UPLOADING -> FINISHED | ERROR, then PUBLISHED.
 * <p>
 * Step 1 creates the container, step 2 streams the whole payload in one request, step 3 polls
 * the container until the platform finishes processing, step 4 publishes and resolves the permalink.
 */
@Component
@Slf4j
public class ResumableSingleShotUpload {

    static final String PERMALINK_FALLBACK = "https://www.instagram.com/reel/";

    private final ResumableUploadApi api;
    private final ConnectorProperties properties;

    public ResumableSingleShotUpload(ResumableUploadApi api, ConnectorProperties properties) {
        this.api = api;
        this.properties = properties;
    }

    public ResumableUploadResult upload(InstagramCredentials account, String caption, byte[] payload) {
        Duration requestTimeout = properties.getRequestTimeout();
        ConnectorProperties.Instagram instagram = properties.getInstagram();

        String containerId = RemoteCalls.call("Instagram container creation",
                () -> api.createContainer(account, caption), requestTimeout, properties.getRetry()).block();
        ReelUploadState state = ReelUploadState.CREATED;
        log.info("Created Instagram container {} for account {}", containerId, account.getAccountRef());

        try {
            state = ReelUploadState.UPLOADING;
            log.info("Uploading {} bytes to container {}", payload.length, containerId);
            RemoteCalls.call("Instagram binary upload",
                    () -> api.uploadBinary(account, containerId, payload),
                    properties.getUploadTimeout(), properties.getRetry()).block();

            StatusPoller.pollUntil("Instagram processing of container " + containerId,
                    () -> RemoteCalls.call("Instagram status check",
                            () -> api.pollStatus(account, containerId), requestTimeout, properties.getRetry()),
                    ResumableSingleShotUpload::decide,
                    instagram.getProcessing()).block();
            state = ReelUploadState.FINISHED;
            log.info("Container {} finished processing", containerId);

            String mediaId = RemoteCalls.call("Instagram publish",
                    () -> api.publish(account, containerId), requestTimeout, instagram.getPublish()).block();
            state = ReelUploadState.PUBLISHED;

            String permalink = RemoteCalls.call("Instagram permalink lookup",
                    () -> api.fetchPermalink(account, mediaId), requestTimeout, properties.getRetry()).block();
            if (permalink == null) {
                permalink = PERMALINK_FALLBACK + mediaId;
            }

            log.info("Published reel {} from container {}: {}", mediaId, containerId, permalink);
            return new ResumableUploadResult(containerId, mediaId, permalink);

        } catch (PublishException e) {
            if (state == ReelUploadState.UPLOADING) {
                state = ReelUploadState.ERROR;
            }
            log.error("Reel upload for container {} ended in state {}: {}", containerId, state, e.getMessage());
            throw e;
        }
    }

    static PollDecision decide(ContainerStatus status) {
        return switch (status.getCode()) {
            case FINISHED, PUBLISHED -> PollDecision.done();
            case ERROR -> PollDecision.failed("processing error: "
                    + (status.getDetail() != null ? status.getDetail() : "no details provided"));
            case EXPIRED -> PollDecision.failed("container expired before processing completed");
            default -> PollDecision.keepPolling();
        };
    }
}
