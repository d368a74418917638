package net.maasbridge.resource.backend;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class CancellationTokenTest {

    @Test
    void shouldPassValueThroughWhenNotCancelled() {
        CancellationToken token = new CancellationToken();

        StepVerifier.create(token.observe(Mono.just("machine")))
                .expectNext("machine")
                .verifyComplete();
    }

    @Test
    void shouldFailImmediatelyWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicBoolean subscribed = new AtomicBoolean();

        StepVerifier.create(token.observe(Mono.just("x").doOnSubscribe(s -> subscribed.set(true))))
                .expectError(CancellationException.class)
                .verify();
        assertThat(subscribed).isFalse();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void cancellingShouldAbortInFlightSourceAndCancelUpstream() {
        CancellationToken token = new CancellationToken();
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        Mono<String> slow = Mono.<String>never().doOnCancel(() -> upstreamCancelled.set(true));

        StepVerifier.create(token.observe(slow))
                .expectSubscription()
                .then(token::cancel)
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(CancellationException.class)
                        .hasMessage("Request was cancelled by the caller"))
                .verify(Duration.ofSeconds(5));
        assertThat(upstreamCancelled).isTrue();
    }

    @Test
    void noneShouldNeverCancelOnItsOwn() {
        CancellationToken token = CancellationToken.none();

        assertThat(token.isCancelled()).isFalse();
        StepVerifier.create(token.observe(Mono.empty())).verifyComplete();
    }
}
