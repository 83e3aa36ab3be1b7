package com.postqueue.connector.support;

import com.postqueue.connector.config.ConnectorProperties;
import com.postqueue.connector.error.PollTimeoutException;
import com.postqueue.connector.error.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bounded retry-with-delay combinator shared by both upload protocols.
 * <p>
 * Polls at most {@code maxAttempts} times, waiting {@code interval} between polls with a
 * timer (no thread is parked), and gives up after {@code maxWait} even if a status call hangs.
 */
@Slf4j
public final class StatusPoller {

    private StatusPoller() {
    }

    public static <S> Mono<S> pollUntil(String subject, Supplier<Mono<S>> statusCall,
                                        Function<S, PollDecision> decide, ConnectorProperties.Poll budget) {
        int maxAttempts = Math.max(1, budget.getMaxAttempts());

        Mono<S> loop = Flux.range(1, maxAttempts)
                .concatMap(attempt -> {
                    Mono<S> status = Mono.defer(statusCall);
                    Mono<S> scheduled = attempt == 1 ? status : Mono.delay(budget.getInterval()).then(status);
                    return scheduled.doOnNext(s -> log.debug("{} poll {}/{}: {}", subject, attempt, maxAttempts, s));
                })
                .<S>handle((status, sink) -> {
                    PollDecision decision = decide.apply(status);
                    switch (decision.getOutcome()) {
                        case DONE -> sink.next(status);
                        case FAILED -> sink.error(new ProtocolException(subject + " failed: " + decision.getReason()));
                        case KEEP_POLLING -> { }
                    }
                })
                .next()
                .switchIfEmpty(Mono.error(() -> new PollTimeoutException(String.format(
                        "%s did not complete after %d polls at %ds interval",
                        subject, maxAttempts, budget.getInterval().toSeconds()))));

        return loop.timeout(budget.getMaxWait(), Mono.error(() -> new PollTimeoutException(String.format(
                "%s did not complete within %s", subject, budget.getMaxWait()))));
    }
}
