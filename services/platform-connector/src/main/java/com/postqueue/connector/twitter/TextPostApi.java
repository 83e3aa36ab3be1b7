package com.postqueue.connector.twitter;

import com.postqueue.connector.credentials.TwitterCredentials;
import reactor.core.publisher.Mono;

import java.util.List;

public interface TextPostApi {

    /**
     * Create a text post, optionally with already processed media attached and optionally as a reply
     * to an existing post ({@code inReplyToPostId} may be null). Returns the post id.
     */
    Mono<String> postText(TwitterCredentials account, String text, List<String> mediaIds, String inReplyToPostId);
}
