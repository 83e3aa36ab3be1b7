package com.postqueue.connector;

import com.postqueue.connector.dto.PublishRequest;
import com.postqueue.connector.dto.PublishResult;
import com.postqueue.connector.model.Platform;

/**
 * Common interface for all platform connectors.
 * Implementations: InstagramConnectorService, TwitterTextConnectorService, TwitterVideoConnectorService
 */
public interface SocialMediaConnector {

    /**
     * Get the platform this connector handles
     */
    Platform getPlatform();

    /**
     * Run the complete publish protocol for one post. Never throws for remote failures:
     * they come back as a failed {@link PublishResult} carrying an error code.
     */
    PublishResult publish(PublishRequest request);
}
