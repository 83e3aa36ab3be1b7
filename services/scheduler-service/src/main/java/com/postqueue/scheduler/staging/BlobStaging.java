package com.postqueue.scheduler.staging;

/**
 * Object store holding media payloads between scheduling and publishing.
 * A staged blob is owned by exactly one scheduled post.
 */
public interface BlobStaging {

    /**
     * Store a payload, returns a publicly fetchable reference
     */
    String put(byte[] content, String contentType);

    /**
     * @throws BlobStagingException if the reference does not resolve
     */
    StagedMedia get(String ref);

    /**
     * Delete a payload. Deleting a missing reference is a no-op.
     */
    void delete(String ref);
}
