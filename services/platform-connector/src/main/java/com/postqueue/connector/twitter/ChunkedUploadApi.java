package com.postqueue.connector.twitter;

import com.postqueue.connector.credentials.TwitterCredentials;
import reactor.core.publisher.Mono;

/**
 * Remote steps of the chunked multipart upload protocol (INIT, APPEND, FINALIZE, STATUS).
 * Every returned Mono is cold: subscribing again repeats the request.
 */
public interface ChunkedUploadApi {

    /**
     * Declare size and category, returns the media identifier
     */
    Mono<String> init(TwitterCredentials account, long totalBytes, String mediaType, String mediaCategory);

    Mono<Void> appendChunk(TwitterCredentials account, String mediaId, int segmentIndex, byte[] chunk);

    /**
     * Signal that every chunk was sent. A SUCCEEDED status means no asynchronous processing is pending.
     */
    Mono<MediaStatus> finalizeUpload(TwitterCredentials account, String mediaId);

    Mono<MediaStatus> pollStatus(TwitterCredentials account, String mediaId);
}
