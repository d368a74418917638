package net.maasbridge.resource.backend;

import java.util.concurrent.CancellationException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Caller-owned signal for early termination of a resource fetch.
 *
 * <p>The token is threaded explicitly through the fetch path. {@link #observe(Mono)} races a
 * fetch against the signal: once {@link #cancel()} is called the fetch subscription is cancelled
 * and the result fails with a {@link CancellationException}.
 */
public final class CancellationToken {

    private final Sinks.Empty<Void> signal = Sinks.empty();
    private volatile boolean cancelled;

    /** A fresh token nobody holds a reference to cancel. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
        signal.tryEmitEmpty();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Completes when the token is cancelled. */
    public Mono<Void> whenCancelled() {
        return signal.asMono();
    }

    /**
     * Ends {@code source} with a {@link CancellationException} as soon as the token is cancelled,
     * cancelling the upstream subscription. Already-cancelled tokens fail before subscribing.
     */
    public <T> Mono<T> observe(Mono<T> source) {
        return Mono.defer(() -> {
            if (cancelled) {
                return Mono.error(aborted());
            }
            Mono<T> onCancel = whenCancelled().then(Mono.error(CancellationToken::aborted));
            return Mono.firstWithSignal(source, onCancel);
        });
    }

    private static CancellationException aborted() {
        return new CancellationException("Request was cancelled by the caller");
    }
}
