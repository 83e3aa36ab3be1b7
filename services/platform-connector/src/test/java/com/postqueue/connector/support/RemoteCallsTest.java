package com.postqueue.connector.support;

import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.error.ProtocolException;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.error.TransientNetworkException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCallsTest {

    private static final ConnectorProperties.Retry BUDGET =
            new ConnectorProperties.Retry(3, Duration.ofMillis(1), Duration.ofMillis(5));

    @Test
    void transientFailuresAreRetriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = RemoteCalls.call("Status check", () -> calls.incrementAndGet() < 3
                ? Mono.error(new TransientNetworkException("connection reset"))
                : Mono.just("ok"), Duration.ofSeconds(5), BUDGET).block();

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void exhaustedRetriesSurfaceTheLastFailure() {
        AtomicInteger calls = new AtomicInteger();

        TransientNetworkException error = assertThrows(TransientNetworkException.class, () ->
                RemoteCalls.call("Binary upload", () -> {
                    calls.incrementAndGet();
                    return Mono.<String>error(new TransientNetworkException("HTTP 503"));
                }, Duration.ofSeconds(5), BUDGET).block());

        assertEquals("HTTP 503", error.getMessage());
        assertEquals(3, calls.get());
    }

    @Test
    void protocolErrorsAreNeverRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ProtocolException.class, () ->
                RemoteCalls.call("Container creation", () -> {
                    calls.incrementAndGet();
                    return Mono.<String>error(new ProtocolException("Invalid OAuth access token"));
                }, Duration.ofSeconds(5), BUDGET).block());

        assertEquals(1, calls.get());
    }

    @Test
    void hungCallTimesOutAndIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientNetworkException.class, () ->
                RemoteCalls.call("Publish", () -> {
                    calls.incrementAndGet();
                    return Mono.<String>never();
                }, Duration.ofMillis(20), new ConnectorProperties.Retry(2, Duration.ofMillis(1), Duration.ofMillis(1)))
                        .block(Duration.ofSeconds(5)));

        assertEquals(2, calls.get());
    }

    @Test
    void singleAttemptBudgetDoesNotRetry() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientNetworkException.class, () ->
                RemoteCalls.call("Publish", () -> {
                    calls.incrementAndGet();
                    return Mono.<String>error(new TransientNetworkException("HTTP 502"));
                }, Duration.ofSeconds(5), new ConnectorProperties.Retry(1, Duration.ofMillis(1), Duration.ofMillis(1)))
                        .block());

        assertEquals(1, calls.get());
    }

    @Test
    void timedOutCreationIsNotRepeated() {
        AtomicInteger calls = new AtomicInteger();

        TransientNetworkException error = assertThrows(TransientNetworkException.class, () ->
                RemoteCalls.callNonIdempotent("Text post", () -> {
                    calls.incrementAndGet();
                    return Mono.<String>never();
                }, Duration.ofMillis(20), BUDGET).block(Duration.ofSeconds(5)));

        assertEquals("Text post timed out", error.getMessage());
        assertEquals(1, calls.get());
    }

    @Test
    void creationErrorAnswersAreStillRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = RemoteCalls.callNonIdempotent("Text post", () -> calls.incrementAndGet() < 2
                ? Mono.<String>error(response(503))
                : Mono.just("1799"), Duration.ofSeconds(5), BUDGET).block();

        assertEquals("1799", result);
        assertEquals(2, calls.get());
    }

    @Test
    void serverErrorsAndThrottlingAreTransient() {
        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", response(503)));
        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", response(500)));
        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", response(429)));
    }

    @Test
    void clientErrorsAreProtocolErrors() {
        Throwable error = RemoteCalls.translate("Post creation", response(403));

        assertInstanceOf(ProtocolException.class, error);
        assertTrue(error.getMessage().contains("HTTP 403"));
        assertTrue(error.getMessage().contains("duplicate content"));
    }

    @Test
    void transportFailuresAreTransient() {
        WebClientRequestException refused = new WebClientRequestException(new IOException("Connection refused"),
                HttpMethod.POST, URI.create("https://upload.example/media"), new HttpHeaders());

        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", refused));
        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", new IOException("reset")));
        assertInstanceOf(TransientNetworkException.class, RemoteCalls.translate("Upload", new TimeoutException()));
    }

    @Test
    void publishExceptionsAndUnknownErrorsPassThrough() {
        PublishException protocol = new ProtocolException("rejected");
        IllegalStateException bug = new IllegalStateException("bug");

        assertSame(protocol, RemoteCalls.translate("Upload", protocol));
        assertSame(bug, RemoteCalls.translate("Upload", bug));
    }

    @Test
    void longBodiesAreAbbreviated() {
        assertEquals(303, RemoteCalls.abbreviate("x".repeat(1000)).length());
        assertEquals("", RemoteCalls.abbreviate(null));
    }

    private static WebClientResponseException response(int status) {
        return WebClientResponseException.create(status, "status " + status, new HttpHeaders(),
                "{\"detail\":\"duplicate content\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }
}
