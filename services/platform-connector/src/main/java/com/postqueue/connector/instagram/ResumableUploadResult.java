package com.postqueue.connector.instagram;

import lombok.Value;

@Value
public class ResumableUploadResult {
    String containerId;
    String mediaId;
    String permalink;
}
