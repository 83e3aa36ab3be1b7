package com.postqueue.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatsResponse {
    private Long totalScheduled;
    private Long pendingCount;
    private Long processingCount;
    private Long postedCount;
    private Long failedCount;
}
