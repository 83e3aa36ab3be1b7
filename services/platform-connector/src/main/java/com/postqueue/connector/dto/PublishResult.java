package com.postqueue.connector.dto;

import com.postqueue.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {
    private Platform platform;
    private boolean success;
    private String publishId;
    private String platformPostId;
    private String shareUrl;
    private String errorCode;
    private String errorMessage;

    public static PublishResult success(Platform platform, String publishId, String platformPostId, String shareUrl) {
        return PublishResult.builder()
                .platform(platform)
                .success(true)
                .publishId(publishId)
                .platformPostId(platformPostId)
                .shareUrl(shareUrl)
                .build();
    }

    public static PublishResult failure(Platform platform, String errorCode, String errorMessage) {
        return PublishResult.builder()
                .platform(platform)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * Human readable failure detail, e.g. "[TIMEOUT] Media processing did not finish"
     */
    public String describeFailure() {
        return String.format("[%s] %s", errorCode, errorMessage);
    }
}
