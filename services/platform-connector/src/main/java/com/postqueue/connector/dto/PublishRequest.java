package com.postqueue.connector.dto;

import com.postqueue.connector.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {
    private UUID postId;
    private Platform platform;
    private String accountRef;
    private String caption;
    @ToString.Exclude
    private byte[] media;
    private String mediaContentType;
    /** Platform id of the post this one answers, for reply chains. */
    private String replyToPostId;

    public boolean hasMedia() {
        return media != null && media.length > 0;
    }
}
