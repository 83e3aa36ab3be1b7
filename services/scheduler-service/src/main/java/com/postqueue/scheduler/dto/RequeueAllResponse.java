package com.postqueue.scheduler.dto;

import lombok.*;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of requeueing every failed post. Media posts are only reported since each one needs a
 * freshly staged blob.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequeueAllResponse {
    private List<ScheduledPostResponse> requeued;
    private List<UUID> needsMedia;
}
