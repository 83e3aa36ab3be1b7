package com.postqueue.scheduler.staging;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class BlobStagingException extends RuntimeException {

    public BlobStagingException(String message) {
        super(message);
    }

    public BlobStagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
