package com.postqueue.scheduler.staging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Stages media in an object storage bucket and hands out public URLs as references.
 */
@Service
@Slf4j
public class ObjectStorageBlobStaging implements BlobStaging {

    private static final String DEFAULT_CONTENT_TYPE = "video/mp4";

    private final WebClient webClient;
    private final StagingProperties properties;

    public ObjectStorageBlobStaging(WebClient.Builder webClientBuilder, StagingProperties properties) {
        this.webClient = webClientBuilder.baseUrl(properties.getUrl()).build();
        this.properties = properties;
    }

    @Override
    public String put(byte[] content, String contentType) {
        if (content == null || content.length == 0) {
            throw new BlobStagingException("Refusing to stage an empty payload");
        }
        String type = contentType != null ? contentType : DEFAULT_CONTENT_TYPE;
        String objectName = UUID.randomUUID().toString().replace("-", "") + extensionFor(type);

        try {
            webClient.post()
                    .uri("/storage/v1/object/{bucket}/{name}", properties.getBucket(), objectName)
                    .headers(this::authorize)
                    .contentType(MediaType.parseMediaType(type))
                    .bodyValue(content)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            throw new BlobStagingException("Failed to stage " + objectName + ": " + e.getMessage(), e);
        }

        String ref = publicUrlPrefix() + objectName;
        log.info("Staged {} bytes ({}) as {}", content.length, type, ref);
        return ref;
    }

    @Override
    public StagedMedia get(String ref) {
        String objectName = objectName(ref);
        ResponseEntity<byte[]> response;
        try {
            response = webClient.get()
                    .uri("/storage/v1/object/public/{bucket}/{name}", properties.getBucket(), objectName)
                    .retrieve()
                    .toEntity(byte[].class)
                    .timeout(properties.getTimeout())
                    .block();
        } catch (RuntimeException e) {
            throw new BlobStagingException("Failed to fetch staged media " + ref + ": " + e.getMessage(), e);
        }

        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw new BlobStagingException("Staged media is empty: " + ref);
        }
        MediaType type = response.getHeaders().getContentType();
        return new StagedMedia(ref, response.getBody(), type != null ? type.toString() : DEFAULT_CONTENT_TYPE);
    }

    @Override
    public void delete(String ref) {
        if (ref == null || ref.isBlank()) {
            return;
        }
        String objectName = objectName(ref);

        try {
            webClient.delete()
                    .uri("/storage/v1/object/{bucket}/{name}", properties.getBucket(), objectName)
                    .headers(this::authorize)
                    .retrieve()
                    .toBodilessEntity()
                    .onErrorResume(WebClientResponseException.class, e -> {
                        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            log.debug("Staged media {} already gone", ref);
                            return Mono.empty();
                        }
                        return Mono.error(new BlobStagingException(
                                "Failed to delete staged media " + ref + ": HTTP " + e.getStatusCode().value(), e));
                    })
                    .timeout(properties.getTimeout())
                    .block();
        } catch (BlobStagingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BlobStagingException("Failed to delete staged media " + ref + ": " + e.getMessage(), e);
        }
        log.info("Removed staged media {}", objectName);
    }

    String publicUrlPrefix() {
        return stripTrailingSlash(properties.getUrl()) + "/storage/v1/object/public/" + properties.getBucket() + "/";
    }

    /**
     * Object name from a public URL: everything after "/{bucket}/"
     */
    String objectName(String ref) {
        String marker = "/" + properties.getBucket() + "/";
        int index = ref.lastIndexOf(marker);
        if (index < 0 || index + marker.length() >= ref.length()) {
            throw new BlobStagingException("Not a reference into bucket " + properties.getBucket() + ": " + ref);
        }
        return ref.substring(index + marker.length());
    }

    private void authorize(HttpHeaders headers) {
        if (properties.getKey() != null) {
            headers.setBearerAuth(properties.getKey());
            headers.set("apikey", properties.getKey());
        }
    }

    private static String extensionFor(String contentType) {
        return switch (contentType) {
            case "video/mp4" -> ".mp4";
            case "video/quicktime" -> ".mov";
            case "image/jpeg" -> ".jpg";
            case "image/png" -> ".png";
            default -> "";
        };
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
