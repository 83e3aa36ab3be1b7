package com.postqueue.connector.twitter;

import com.postqueue.connector.SocialMediaConnector;
import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.AccountCredentialsProvider;
import com.postqueue.connector.credentials.TwitterCredentials;
import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.model.ContentLimits;
import com.postqueue.connector.model.Platform;
import com.postqueue.connector.support.RemoteCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Text post with one attached video: chunked upload first, then the post referencing the media id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TwitterVideoConnectorService implements SocialMediaConnector {

    private final AccountCredentialsProvider credentialsProvider;
    private final ChunkedMultipartUpload chunkedUpload;
    private final TextPostApi textPostApi;
    private final ConnectorProperties properties;

    @Override
    public Platform getPlatform() {
        return Platform.VIDEO_ATTACHED;
    }

    @Override
    public PublishResult publish(PublishRequest request) {
        log.info("Publishing video post {} for account {}", request.getPostId(), request.getAccountRef());

        if (!request.hasMedia()) {
            return PublishResult.failure(Platform.VIDEO_ATTACHED, "MEDIA_MISSING", "Video post requires a video");
        }

        ContentLimits limits = Platform.VIDEO_ATTACHED.toContentLimits();
        if (!limits.isValidFileSize(request.getMedia().length)) {
            return PublishResult.failure(Platform.VIDEO_ATTACHED, "MEDIA_TOO_LARGE",
                    String.format("Video size (%d bytes) exceeds the %d byte upload limit",
                            request.getMedia().length, limits.getMaxFileSizeBytes()));
        }

        try {
            TwitterCredentials account = credentialsProvider.twitter(request.getAccountRef());
            String mediaId = chunkedUpload.upload(account, request.getMedia(), request.getMediaContentType());

            String postId = RemoteCalls.callNonIdempotent("Post with media " + mediaId,
                    () -> textPostApi.postText(account, request.getCaption(), List.of(mediaId),
                            request.getReplyToPostId()),
                    properties.getRequestTimeout(), properties.getTwitter().getPost()).block();

            return PublishResult.success(Platform.VIDEO_ATTACHED, mediaId, postId,
                    TwitterTextConnectorService.STATUS_URL + postId);

        } catch (PublishException e) {
            return PublishResult.failure(Platform.VIDEO_ATTACHED, e.errorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Error publishing video post {}: {}", request.getPostId(), e.getMessage(), e);
            return PublishResult.failure(Platform.VIDEO_ATTACHED, "INTERNAL_ERROR", e.getMessage());
        }
    }
}
