package com.postqueue.scheduler.staging;

import lombok.ToString;
import lombok.Value;

@Value
public class StagedMedia {
    String ref;
    @ToString.Exclude
    byte[] content;
    String contentType;

    public int size() {
        return content.length;
    }
}
