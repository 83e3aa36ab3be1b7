package com.postqueue.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

/**
 * Re-create a failed post. Media posts need a freshly staged blob since the old one was deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequeueRequest {
    private String mediaRef;
    private OffsetDateTime scheduledTime;
}
