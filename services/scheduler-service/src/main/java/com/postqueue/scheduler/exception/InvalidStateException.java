package com.postqueue.scheduler.exception;

import com.postqueue.scheduler.entity.PostStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

/**
 * The requested transition is not allowed from the post's current status.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(UUID postId, String operation, PostStatus actual, PostStatus required) {
        super(String.format("Cannot %s post %s: status is %s, expected %s", operation, postId, actual, required));
    }
}
