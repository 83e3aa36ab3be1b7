package com.postqueue.connector.twitter;

import java.util.Locale;

public enum MediaProcessingState {
    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED;

    public static MediaProcessingState from(String value) {
        if (value == null) {
            return SUCCEEDED;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "pending" -> PENDING;
            case "succeeded" -> SUCCEEDED;
            case "failed" -> FAILED;
            // unknown states keep the bounded poll going
            default -> IN_PROGRESS;
        };
    }
}
