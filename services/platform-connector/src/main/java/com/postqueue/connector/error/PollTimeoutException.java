package com.postqueue.connector.error;

/**
 * A status poll ran out of attempts or hit its deadline before the remote side reached a terminal state.
 */
public class PollTimeoutException extends PublishException {

    public PollTimeoutException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "TIMEOUT";
    }
}
