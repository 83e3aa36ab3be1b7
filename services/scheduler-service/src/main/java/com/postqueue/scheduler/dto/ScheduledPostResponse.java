package com.postqueue.scheduler.dto;

import com.postqueue.connector.model.Platform;
import com.postqueue.scheduler.entity.PostStatus;
import com.postqueue.scheduler.entity.ScheduledPost;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPostResponse {
    private UUID id;
    private Platform platform;
    private String accountRef;
    private String mediaRef;
    private String caption;
    private String replyToPostId;
    private OffsetDateTime scheduledTime;
    private PostStatus status;
    private OffsetDateTime postedAt;
    private String errorDetail;
    private String platformPostId;
    private String shareUrl;
    private UUID requeuedFrom;
    private OffsetDateTime createdAt;

    public static ScheduledPostResponse from(ScheduledPost post) {
        return ScheduledPostResponse.builder()
                .id(post.getId())
                .platform(post.getPlatform())
                .accountRef(post.getAccountRef())
                .mediaRef(post.getMediaRef())
                .caption(post.getCaption())
                .replyToPostId(post.getReplyToPostId())
                .scheduledTime(post.getScheduledTime())
                .status(post.getStatus())
                .postedAt(post.getPostedAt())
                .errorDetail(post.getErrorDetail())
                .platformPostId(post.getPlatformPostId())
                .shareUrl(post.getShareUrl())
                .requeuedFrom(post.getRequeuedFrom())
                .createdAt(post.getCreatedAt())
                .build();
    }
}
