package com.postqueue.connector.support;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Verdict on one observed remote status during a poll loop.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PollDecision {

    public enum Outcome {
        DONE,
        KEEP_POLLING,
        FAILED
    }

    private static final PollDecision DONE = new PollDecision(Outcome.DONE, null);
    private static final PollDecision KEEP_POLLING = new PollDecision(Outcome.KEEP_POLLING, null);

    private final Outcome outcome;
    private final String reason;

    public static PollDecision done() {
        return DONE;
    }

    public static PollDecision keepPolling() {
        return KEEP_POLLING;
    }

    public static PollDecision failed(String reason) {
        return new PollDecision(Outcome.FAILED, reason);
    }
}
