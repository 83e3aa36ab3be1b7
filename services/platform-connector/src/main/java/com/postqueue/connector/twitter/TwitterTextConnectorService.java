package com.postqueue.connector.twitter;

import com.postqueue.connector.SocialMediaConnector;
import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.AccountCredentialsProvider;
import com.postqueue.connector.credentials.TwitterCredentials;
import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.model.Platform;
import com.postqueue.connector.support.RemoteCalls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Text-only posts: a single post creation call, no upload protocol.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TwitterTextConnectorService implements SocialMediaConnector {

    static final String STATUS_URL = "https://x.com/i/web/status/";

    private final AccountCredentialsProvider credentialsProvider;
    private final TextPostApi textPostApi;
    private final ConnectorProperties properties;

    @Override
    public Platform getPlatform() {
        return Platform.TEXT_ONLY;
    }

    @Override
    public PublishResult publish(PublishRequest request) {
        log.info("Publishing text post {} for account {}", request.getPostId(), request.getAccountRef());

        try {
            TwitterCredentials account = credentialsProvider.twitter(request.getAccountRef());
            String postId = RemoteCalls.callNonIdempotent("Text post",
                    () -> textPostApi.postText(account, request.getCaption(), List.of(), request.getReplyToPostId()),
                    properties.getRequestTimeout(), properties.getTwitter().getPost()).block();

            return PublishResult.success(Platform.TEXT_ONLY, postId, postId, STATUS_URL + postId);

        } catch (PublishException e) {
            log.error("Text post {} failed: {}", request.getPostId(), e.getMessage());
            return PublishResult.failure(Platform.TEXT_ONLY, e.errorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Error publishing text post {}: {}", request.getPostId(), e.getMessage(), e);
            return PublishResult.failure(Platform.TEXT_ONLY, "INTERNAL_ERROR", e.getMessage());
        }
    }
}
