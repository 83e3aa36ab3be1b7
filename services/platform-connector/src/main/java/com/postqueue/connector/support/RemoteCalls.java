package com.postqueue.connector.support;

import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.error.ProtocolException;
import com.postqueue.connector.error.PublishException;
import com.postqueue.connector.error.TransientNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Wraps one remote call with a request timeout, error classification and bounded
 * exponential backoff on transient failures.
 */
@Slf4j
public final class RemoteCalls {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    private RemoteCalls() {
    }

    public static <T> Mono<T> call(String operation, Supplier<Mono<T>> request,
                                   Duration timeout, ConnectorProperties.Retry budget) {
        return Mono.defer(request)
                .timeout(timeout)
                .onErrorMap(e -> translate(operation, e))
                .retryWhen(retrySpec(operation, budget, RemoteCalls::isRetryable));
    }

    /**
     * Like {@link #call} for requests that create something remotely. A request whose response timed
     * out may already have been applied, so it is never repeated. Error answers such as 5xx and 429
     * are still retried.
     */
    public static <T> Mono<T> callNonIdempotent(String operation, Supplier<Mono<T>> request,
                                                Duration timeout, ConnectorProperties.Retry budget) {
        return Mono.defer(request)
                .timeout(timeout)
                .onErrorMap(e -> translate(operation, e))
                .retryWhen(retrySpec(operation, budget, e -> isRetryable(e) && !isResponseTimeout(e)));
    }

    static Retry retrySpec(String operation, ConnectorProperties.Retry budget, Predicate<Throwable> retryable) {
        int retries = Math.max(0, budget.getMaxAttempts() - 1);

        return Retry.backoff(retries, budget.getInitialBackoff())
                .maxBackoff(budget.getMaxBackoff())
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("{} failed (attempt {}/{}), retrying: {}",
                        operation, signal.totalRetries() + 1, retries + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Map transport level failures onto the publish error taxonomy
     */
    public static Throwable translate(String operation, Throwable error) {
        if (error instanceof PublishException) {
            return error;
        }

        if (error instanceof WebClientResponseException response) {
            String message = String.format("%s failed (HTTP %d): %s",
                    operation, response.getStatusCode().value(), abbreviate(response.getResponseBodyAsString()));
            if (response.getStatusCode().is5xxServerError()
                    || response.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return new TransientNetworkException(message, error);
            }
            return new ProtocolException(message, error);
        }

        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new TransientNetworkException(operation + " failed: " + error.getMessage(), error);
        }

        if (error instanceof TimeoutException) {
            return new TransientNetworkException(operation + " timed out", error);
        }

        return error;
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof PublishException pe && pe.isRetryable();
    }

    static boolean isResponseTimeout(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
