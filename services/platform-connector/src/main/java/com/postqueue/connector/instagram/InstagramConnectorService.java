package com.postqueue.connector.instagram;

import com.postqueue.connector.SocialMediaConnector;
import com.postqueue.connector.credentials.AccountCredentialsProvider;
import com.postqueue.connector.credentials.InstagramCredentials;
import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.model.ContentLimits;
import com.postqueue.connector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Instagram Reels connector using the Graph API resumable upload protocol.
 * Requires a Facebook Business account with an Instagram Professional Account linked.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstagramConnectorService implements SocialMediaConnector {

    private final AccountCredentialsProvider credentialsProvider;
    private final ResumableSingleShotUpload resumableUpload;

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public PublishResult publish(PublishRequest request) {
        log.info("Publishing Instagram Reel {} for account {}", request.getPostId(), request.getAccountRef());

        if (!request.hasMedia()) {
            return PublishResult.failure(Platform.INSTAGRAM, "MEDIA_MISSING", "Instagram post requires a video");
        }

        ContentLimits limits = Platform.INSTAGRAM.toContentLimits();
        if (!limits.isValidFileSize(request.getMedia().length)) {
            return PublishResult.failure(Platform.INSTAGRAM, "MEDIA_TOO_LARGE",
                    String.format("Video size (%d bytes) exceeds Instagram limit of 4GB", request.getMedia().length));
        }

        try {
            InstagramCredentials account = credentialsProvider.instagram(request.getAccountRef());
            ResumableUploadResult result = resumableUpload.upload(account, request.getCaption(), request.getMedia());

            return PublishResult.success(Platform.INSTAGRAM, result.getContainerId(),
                    result.getMediaId(), result.getPermalink());

        } catch (PublishException e) {
            return PublishResult.failure(Platform.INSTAGRAM, e.errorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Error publishing Instagram Reel {}: {}", request.getPostId(), e.getMessage(), e);
            return PublishResult.failure(Platform.INSTAGRAM, "INTERNAL_ERROR", e.getMessage());
        }
    }
}
