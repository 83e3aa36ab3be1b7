package com.postqueue.connector.instagram;

/**
 * Client side view of a resumable reel upload.
 */
public enum ReelUploadState {
    CREATED,
    UPLOADING,
    FINISHED,
    ERROR,
    PUBLISHED
}
