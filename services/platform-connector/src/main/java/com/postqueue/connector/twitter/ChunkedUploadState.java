package com.postqueue.connector.twitter;

/**
 * Client side view of a chunked media upload.
 */
public enum ChunkedUploadState {
    INIT,
    APPENDING,
    FINALIZING,
    PROCESSING,
    SUCCEEDED,
    FAILED
}
