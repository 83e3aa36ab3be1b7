package com.postqueue.connector.error;

/**
 * The remote side answered with a well-formed permanent error (bad auth, rejected content,
 * quota exceeded, processing ERROR). Never retried.
 */
public class ProtocolException extends PublishException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "PROTOCOL_ERROR";
    }
}
