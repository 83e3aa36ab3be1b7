package com.postqueue.connector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum Platform {
    INSTAGRAM(
        "instagram",
        "Instagram",
        true,       // media upload required
        false,      // caption optional
        2200,       // caption length
        4L * 1024 * 1024 * 1024 // 4GB max file size
    ),
    TEXT_ONLY(
        "text_only",
        "Text-only",
        false,
        true,
        280,
        0L
    ),
    VIDEO_ATTACHED(
        "video_attached",
        "Video-attached",
        true,
        false,
        280,
        512L * 1024 * 1024 // 512MB chunked upload limit
    );

    private final String wireName;
    private final String displayName;
    private final boolean requiresMedia;
    private final boolean captionRequired;
    private final int maxCaptionLength;
    private final long maxFileSizeBytes;

    Platform(String wireName, String displayName, boolean requiresMedia,
             boolean captionRequired, int maxCaptionLength, long maxFileSizeBytes) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.requiresMedia = requiresMedia;
        this.captionRequired = captionRequired;
        this.maxCaptionLength = maxCaptionLength;
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts both the wire name ("video_attached") and the constant name ("VIDEO_ATTACHED")
     */
    @JsonCreator
    public static Platform fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(p -> p.wireName.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + value));
    }

    public ContentLimits toContentLimits() {
        return ContentLimits.builder()
                .platform(this)
                .requiresMedia(requiresMedia)
                .captionRequired(captionRequired)
                .maxCaptionLength(maxCaptionLength)
                .maxFileSizeBytes(maxFileSizeBytes)
                .build();
    }
}
