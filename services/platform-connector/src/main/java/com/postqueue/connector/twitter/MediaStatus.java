package com.postqueue.connector.twitter;

import lombok.Value;

@Value
public class MediaStatus {
    String mediaId;
    MediaProcessingState state;
    Integer checkAfterSecs;
    String error;

    public static MediaStatus of(String mediaId, MediaProcessingState state) {
        return new MediaStatus(mediaId, state, null, null);
    }
}
