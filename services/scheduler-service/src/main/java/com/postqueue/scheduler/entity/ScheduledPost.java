package com.postqueue.scheduler.entity;

import com.postqueue.connector.model.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "scheduled_posts", indexes = {
        @Index(name = "idx_scheduled_posts_status_time", columnList = "status, scheduled_time"),
        @Index(name = "idx_scheduled_posts_account", columnList = "account_ref, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPost {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private Platform platform;

    @Column(name = "account_ref", nullable = false, length = 100)
    private String accountRef;

    @Column(name = "media_ref", length = 1000)
    private String mediaRef;

    @Column(columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private String caption = "";

    /** Platform id of the post this one answers. */
    @Column(name = "reply_to_post_id", length = 100)
    private String replyToPostId;

    @Column(name = "scheduled_time", nullable = false)
    private OffsetDateTime scheduledTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PostStatus status = PostStatus.PENDING;

    @Column(name = "posted_at")
    private OffsetDateTime postedAt;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "platform_post_id", length = 100)
    private String platformPostId;

    @Column(name = "share_url", length = 1000)
    private String shareUrl;

    @Column(name = "requeued_from")
    private UUID requeuedFrom;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean hasMedia() {
        return mediaRef != null;
    }
}
