package com.postqueue.scheduler.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * PENDING -> PROCESSING -> POSTED | FAILED. No other transition exists.
 */
public enum PostStatus {
    PENDING,
    PROCESSING,
    POSTED,
    FAILED;

    /** Statuses that still occupy a slot of the account chain. */
    public static final Set<PostStatus> LIVE = EnumSet.of(PENDING, PROCESSING);

    public boolean isTerminal() {
        return this == POSTED || this == FAILED;
    }
}
