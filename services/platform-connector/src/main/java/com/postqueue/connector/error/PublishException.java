package com.postqueue.connector.error;

/**
 * Base type of every failure raised while driving a platform protocol.
 * The error code ends up in the stored error detail of the post.
 */
public abstract class PublishException extends RuntimeException {

    protected PublishException(String message) {
        super(message);
    }

    protected PublishException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();

    public boolean isRetryable() {
        return false;
    }
}
