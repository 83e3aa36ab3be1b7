package com.postqueue.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RescheduleRequest {
    private OffsetDateTime scheduledTime;
}
