package com.postqueue.scheduler.dto;

import com.postqueue.connector.model.Platform;
import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduledPostRequest {
    private Platform platform;
    private String accountRef;
    private String mediaRef;
    private String caption;
    /** Platform id of an already published post to answer, for reply chains. */
    private String replyToPostId;
    /** Explicit publication time; the account's next chain slot when absent. */
    private OffsetDateTime scheduledTime;
}
