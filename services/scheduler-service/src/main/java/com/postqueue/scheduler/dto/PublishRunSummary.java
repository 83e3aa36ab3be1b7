package com.postqueue.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one publisher run. Skipped posts were claimed by a concurrent run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRunSummary {
    private int due;
    private int published;
    private int failed;
    private int skipped;

    public static PublishRunSummary empty() {
        return new PublishRunSummary(0, 0, 0, 0);
    }
}
