package com.postqueue.connector.error;

/**
 * Timeouts, connection resets, 5xx and 429 responses. Retried with backoff up to the
 * configured attempt cap before the failure becomes terminal.
 */
public class TransientNetworkException extends PublishException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "TRANSIENT_ERROR";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
