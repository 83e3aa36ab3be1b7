package com.postqueue.connector.instagram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.credentials.InstagramCredentials;
import com.postqueue.connector.error.ProtocolException;
import com.postqueue.connector.error.TransientNetworkException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Instagram Graph API client for Reels publishing through the resumable upload host.
 *
 * API Documentation: https://developers.facebook.com/docs/instagram-platform/content-publishing/resumable-uploads
 */
@Component
@Slf4j
public class InstagramGraphClient implements ResumableUploadApi {

    /** Graph error (sub)codes meaning "media not ready yet, try again". */
    private static final Set<Long> NOT_READY_CODES = Set.of(2207026L, 2207027L);

    private final WebClient webClient;
    private final ConnectorProperties.Instagram properties;

    public InstagramGraphClient(WebClient.Builder webClientBuilder, ConnectorProperties connectorProperties) {
        this.webClient = webClientBuilder.build();
        this.properties = connectorProperties.getInstagram();
    }

    @Override
    public Mono<String> createContainer(InstagramCredentials account, String caption) {
        return webClient.post()
                .uri(properties.getGraphApiUrl()
                                + "/{igUserId}/media?media_type=REELS&upload_type=resumable&caption={caption}&access_token={token}",
                        account.getBusinessAccountId(), caption != null ? caption : "", account.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toGraphException("Container creation", response))
                .bodyToMono(InstagramMediaResponse.class)
                .flatMap(response -> requireId("Container creation", response));
    }

    @Override
    public Mono<Void> uploadBinary(InstagramCredentials account, String containerId, byte[] payload) {
        return webClient.post()
                .uri(properties.getRuploadUrl() + "/{containerId}", containerId)
                .header(HttpHeaders.AUTHORIZATION, "OAuth " + account.getAccessToken())
                .header("offset", "0")
                .header("file_size", String.valueOf(payload.length))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toGraphException("Binary upload", response))
                .bodyToMono(RuploadResponse.class)
                .<RuploadResponse>handle((response, sink) -> {
                    if (!response.isSuccess()) {
                        sink.error(new ProtocolException("Binary upload rejected: " + response.getMessage()));
                    }
                })
                .then();
    }

    @Override
    public Mono<ContainerStatus> pollStatus(InstagramCredentials account, String containerId) {
        return webClient.get()
                .uri(properties.getGraphApiUrl() + "/{containerId}?fields=status_code,status&access_token={token}",
                        containerId, account.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toGraphException("Status check", response))
                .bodyToMono(InstagramContainerStatus.class)
                .map(status -> new ContainerStatus(ContainerStatusCode.from(status.getStatusCode()), status.getStatus()));
    }

    @Override
    public Mono<String> publish(InstagramCredentials account, String containerId) {
        return webClient.post()
                .uri(properties.getGraphApiUrl() + "/{igUserId}/media_publish?creation_id={containerId}&access_token={token}",
                        account.getBusinessAccountId(), containerId, account.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toGraphException("Publish", response))
                .bodyToMono(InstagramMediaResponse.class)
                .flatMap(response -> requireId("Publish", response));
    }

    @Override
    public Mono<String> fetchPermalink(InstagramCredentials account, String mediaId) {
        return webClient.get()
                .uri(properties.getGraphApiUrl() + "/{mediaId}?fields=permalink&access_token={token}",
                        mediaId, account.getAccessToken())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> toGraphException("Permalink lookup", response))
                .bodyToMono(InstagramPermalinkResponse.class)
                .mapNotNull(InstagramPermalinkResponse::getPermalink);
    }

    private Mono<String> requireId(String operation, InstagramMediaResponse response) {
        if (response.getId() == null) {
            return Mono.error(new ProtocolException(operation + " returned no id: " + response));
        }
        return Mono.just(response.getId());
    }

    private Mono<Throwable> toGraphException(String operation, ClientResponse response) {
        HttpStatusCode status = response.statusCode();

        return response.bodyToMono(GraphErrorEnvelope.class)
                .onErrorResume(e -> {
                    log.debug("{} returned an unreadable error body: {}", operation, e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(new GraphErrorEnvelope())
                .map(envelope -> classify(operation, status, envelope.getError()));
    }

    static Throwable classify(String operation, HttpStatusCode status, GraphError error) {
        String message = String.format("%s failed (HTTP %d): %s", operation, status.value(),
                error != null && error.getMessage() != null ? error.getMessage() : "no error details");

        if (error != null && (isNotReady(error.getCode())
                || isNotReady(error.getErrorSubcode())
                || Boolean.TRUE.equals(error.getIsTransient()))) {
            return new TransientNetworkException(message);
        }
        if (status.is5xxServerError() || status.value() == 429) {
            return new TransientNetworkException(message);
        }
        return new ProtocolException(message);
    }

    private static boolean isNotReady(Long code) {
        return code != null && NOT_READY_CODES.contains(code);
    }
}

// Instagram API Response DTOs
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class InstagramMediaResponse {
    private String id;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class InstagramContainerStatus {
    @JsonProperty("status_code")
    private String statusCode; // IN_PROGRESS, FINISHED, ERROR, EXPIRED, PUBLISHED
    private String status;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class InstagramPermalinkResponse {
    private String id;
    private String permalink;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class RuploadResponse {
    private boolean success;
    private String message;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphErrorEnvelope {
    private GraphError error;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphError {
    private String message;
    private String type;
    private Long code;
    @JsonProperty("error_subcode")
    private Long errorSubcode;
    @JsonProperty("is_transient")
    private Boolean isTransient;
}
