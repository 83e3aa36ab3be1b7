package com.postqueue.connector.twitter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.TwitterCredentials;
import com.postqueue.connector.error.ProtocolException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Twitter client: v1.1 chunked media upload and v2 post creation.
 */
@Component
public class TwitterApiClient implements ChunkedUploadApi, TextPostApi {

    private final WebClient webClient;
    private final ConnectorProperties.Twitter properties;

    public TwitterApiClient(WebClient.Builder webClientBuilder, ConnectorProperties connectorProperties) {
        this.webClient = webClientBuilder.build();
        this.properties = connectorProperties.getTwitter();
    }

    // ========================================
    // Chunked Media Upload
    // ========================================

    @Override
    public Mono<String> init(TwitterCredentials account, long totalBytes, String mediaType, String mediaCategory) {
        return webClient.post()
                .uri(properties.getMediaUploadUrl())
                .header(HttpHeaders.AUTHORIZATION, bearer(account))
                .body(BodyInserters.fromFormData("command", "INIT")
                        .with("total_bytes", String.valueOf(totalBytes))
                        .with("media_type", mediaType)
                        .with("media_category", mediaCategory))
                .retrieve()
                .bodyToMono(MediaUploadResponse.class)
                .flatMap(response -> response.getMediaIdString() != null
                        ? Mono.just(response.getMediaIdString())
                        : Mono.error(new ProtocolException("Media INIT returned no media id: " + response)));
    }

    @Override
    public Mono<Void> appendChunk(TwitterCredentials account, String mediaId, int segmentIndex, byte[] chunk) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("command", "APPEND");
        body.part("media_id", mediaId);
        body.part("segment_index", String.valueOf(segmentIndex));
        body.part("media", new ByteArrayResource(chunk))
                .filename("segment-" + segmentIndex)
                .contentType(MediaType.APPLICATION_OCTET_STREAM);

        return webClient.post()
                .uri(properties.getMediaUploadUrl())
                .header(HttpHeaders.AUTHORIZATION, bearer(account))
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    @Override
    public Mono<MediaStatus> finalizeUpload(TwitterCredentials account, String mediaId) {
        return webClient.post()
                .uri(properties.getMediaUploadUrl())
                .header(HttpHeaders.AUTHORIZATION, bearer(account))
                .body(BodyInserters.fromFormData("command", "FINALIZE").with("media_id", mediaId))
                .retrieve()
                .bodyToMono(MediaUploadResponse.class)
                .map(response -> toStatus(mediaId, response));
    }

    @Override
    public Mono<MediaStatus> pollStatus(TwitterCredentials account, String mediaId) {
        return webClient.get()
                .uri(properties.getMediaUploadUrl() + "?command=STATUS&media_id={mediaId}", mediaId)
                .header(HttpHeaders.AUTHORIZATION, bearer(account))
                .retrieve()
                .bodyToMono(MediaUploadResponse.class)
                .map(response -> toStatus(mediaId, response));
    }

    // ========================================
    // Posts
    // ========================================

    @Override
    public Mono<String> postText(TwitterCredentials account, String text, List<String> mediaIds,
                                 String inReplyToPostId) {
        return webClient.post()
                .uri(properties.getApiUrl() + "/tweets")
                .header(HttpHeaders.AUTHORIZATION, bearer(account))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(postBody(text, mediaIds, inReplyToPostId))
                .retrieve()
                .bodyToMono(TweetResponse.class)
                .flatMap(response -> response.getData() != null && response.getData().getId() != null
                        ? Mono.just(response.getData().getId())
                        : Mono.error(new ProtocolException("Post creation returned no id")));
    }

    static Map<String, Object> postBody(String text, List<String> mediaIds, String inReplyToPostId) {
        Map<String, Object> body = new HashMap<>();
        body.put("text", text);
        if (mediaIds != null && !mediaIds.isEmpty()) {
            body.put("media", Map.of("media_ids", mediaIds));
        }
        if (inReplyToPostId != null && !inReplyToPostId.isBlank()) {
            body.put("reply", Map.of("in_reply_to_tweet_id", inReplyToPostId));
        }
        return body;
    }

    static MediaStatus toStatus(String mediaId, MediaUploadResponse response) {
        ProcessingInfo info = response.getProcessingInfo();
        if (info == null) {
            return MediaStatus.of(mediaId, MediaProcessingState.SUCCEEDED);
        }
        String error = info.getError() != null ? info.getError().getMessage() : null;
        return new MediaStatus(mediaId, MediaProcessingState.from(info.getState()), info.getCheckAfterSecs(), error);
    }

    private static String bearer(TwitterCredentials account) {
        return "Bearer " + account.getBearerToken();
    }
}

// Twitter API Response DTOs
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class MediaUploadResponse {
    @JsonProperty("media_id_string")
    private String mediaIdString;
    @JsonProperty("processing_info")
    private ProcessingInfo processingInfo;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class ProcessingInfo {
    private String state; // pending, in_progress, succeeded, failed
    @JsonProperty("check_after_secs")
    private Integer checkAfterSecs;
    @JsonProperty("progress_percent")
    private Integer progressPercent;
    private ProcessingError error;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class ProcessingError {
    private Integer code;
    private String name;
    private String message;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class TweetResponse {
    private TweetData data;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class TweetData {
    private String id;
    private String text;
}
