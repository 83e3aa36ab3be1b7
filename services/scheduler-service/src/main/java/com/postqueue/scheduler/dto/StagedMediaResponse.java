package com.postqueue.scheduler.dto;

import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StagedMediaResponse {
    private String mediaRef;
    private String contentType;
    private Long sizeBytes;
}
