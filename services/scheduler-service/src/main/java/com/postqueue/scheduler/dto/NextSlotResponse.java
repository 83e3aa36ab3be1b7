package com.postqueue.scheduler.dto;

import lombok.*;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NextSlotResponse {
    private String accountRef;
    private OffsetDateTime chainTail;
    private OffsetDateTime nextSlot;
}
