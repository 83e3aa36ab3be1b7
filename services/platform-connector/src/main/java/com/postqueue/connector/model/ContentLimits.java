package com.postqueue.connector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentLimits {
    private Platform platform;
    private boolean requiresMedia;
    private boolean captionRequired;
    private int maxCaptionLength;
    private long maxFileSizeBytes;

    /**
     * Check if caption length is valid
     */
    public boolean isValidCaptionLength(String caption) {
        return caption == null || caption.length() <= maxCaptionLength;
    }

    /**
     * Check if file size is valid
     */
    public boolean isValidFileSize(long sizeBytes) {
        return sizeBytes > 0 && sizeBytes <= maxFileSizeBytes;
    }

    /**
     * Collect every rule the given content breaks; empty when the content can be scheduled
     */
    public List<String> violations(String caption, boolean hasMedia) {
        List<String> violations = new ArrayList<>();

        if (requiresMedia && !hasMedia) {
            violations.add(String.format("%s posts require a media reference", platform.getDisplayName()));
        }
        if (!requiresMedia && hasMedia) {
            violations.add(String.format("%s posts must not carry a media reference", platform.getDisplayName()));
        }
        if (caption == null) {
            violations.add("Caption must be present (use an empty caption for media-only posts)");
        } else {
            if (captionRequired && caption.isBlank()) {
                violations.add(String.format("%s posts require a non-empty caption", platform.getDisplayName()));
            }
            if (!isValidCaptionLength(caption)) {
                violations.add(String.format("Caption length (%d) exceeds %s limit (%d)",
                        caption.length(), platform.getDisplayName(), maxCaptionLength));
            }
        }

        return violations;
    }
}
