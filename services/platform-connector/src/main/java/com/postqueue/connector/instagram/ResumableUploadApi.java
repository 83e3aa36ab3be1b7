package com.postqueue.connector.instagram;

import com.postqueue.connector.credentials.InstagramCredentials;
import reactor.core.publisher.Mono;

/**
 * Remote steps of the resumable single-shot upload protocol.
 * Every returned Mono is cold: subscribing again repeats the request.
 */
public interface ResumableUploadApi {

    /**
     * Create the upload container, returns its identifier
     */
    Mono<String> createContainer(InstagramCredentials account, String caption);

    /**
     * Send the whole payload in one request, declaring its total size
     */
    Mono<Void> uploadBinary(InstagramCredentials account, String containerId, byte[] payload);

    Mono<ContainerStatus> pollStatus(InstagramCredentials account, String containerId);

    /**
     * Publish a FINISHED container, returns the id of the resulting media
     */
    Mono<String> publish(InstagramCredentials account, String containerId);

    /**
     * Public URL of a published media; empty when the platform has none yet
     */
    Mono<String> fetchPermalink(InstagramCredentials account, String mediaId);
}
