package io.leavesfly.meer.llm;

import io.leavesfly.meer.config.RetryConfig;
import io.leavesfly.meer.exception.ProviderException;
import io.leavesfly.meer.llm.message.Message;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryingChatProvider 单元测试
 */
class RetryingChatProviderTest {

    private static final List<Message> HISTORY = List.of(Message.user("hi"));

    private static RetryConfig fastRetry(int attempts) {
        return RetryConfig.builder()
                .maxAttempts(attempts)
                .initialBackoffMs(5)
                .maxBackoffMs(20)
                .build();
    }

    @Test
    void testTransientFailureIsRetried() {
        ScriptedChatProvider delegate = ScriptedChatProvider.of()
                .thenFail(new ProviderException("HTTP 503: unavailable", 503, null))
                .thenFail(new ProviderException("Network error", ProviderException.NETWORK_ERROR, null))
                .then("recovered");

        StepVerifier.create(new RetryingChatProvider(delegate, fastRetry(3)).chat(HISTORY))
                .expectNext("recovered")
                .verifyComplete();

        assertEquals(3, delegate.getCalls());
    }

    @Test
    void testClientErrorIsNotRetried() {
        ScriptedChatProvider delegate = ScriptedChatProvider.of()
                .thenFail(new ProviderException("HTTP 401: Unauthorized", 401, null))
                .then("never reached");

        StepVerifier.create(new RetryingChatProvider(delegate, fastRetry(3)).chat(HISTORY))
                .expectErrorMessage("HTTP 401: Unauthorized")
                .verify();

        assertEquals(1, delegate.getCalls());
    }

    @Test
    void testExhaustedRetriesSurfaceOriginalError() {
        ScriptedChatProvider delegate = ScriptedChatProvider.of();
        for (int i = 0; i < 3; i++) {
            delegate.thenFail(new ProviderException("HTTP 429: slow down", 429, null));
        }

        StepVerifier.create(new RetryingChatProvider(delegate, fastRetry(2)).chat(HISTORY))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(ProviderException.class, e);
                    assertEquals(429, ((ProviderException) e).getStatusCode());
                })
                .verify();

        assertEquals(3, delegate.getCalls());
    }

    @Test
    void testZeroAttemptsDisablesRetry() {
        ScriptedChatProvider delegate = ScriptedChatProvider.of()
                .thenFail(new ProviderException("HTTP 500", 500, null))
                .then("unused");

        StepVerifier.create(new RetryingChatProvider(delegate, fastRetry(0)).chat(HISTORY))
                .expectError(ProviderException.class)
                .verify();

        assertEquals(1, delegate.getCalls());
    }

    @Test
    void testStreamIsNotRetriedAfterChunks() {
        AtomicInteger subscriptions = new AtomicInteger();
        ChatProvider flaky = new ChatProvider() {
            @Override
            public Mono<String> chat(List<Message> history) {
                return Mono.just("unused");
            }

            @Override
            public Flux<String> stream(List<Message> history) {
                return Flux.defer(() -> {
                    subscriptions.incrementAndGet();
                    return Flux.concat(Flux.just("partial"),
                            Flux.error(new ProviderException("Network error", ProviderException.NETWORK_ERROR, null)));
                });
            }

            @Override
            public String getModelName() {
                return "flaky";
            }
        };

        StepVerifier.create(new RetryingChatProvider(flaky, fastRetry(3)).stream(HISTORY))
                .expectNext("partial")
                .expectError(ProviderException.class)
                .verify();

        assertEquals(1, subscriptions.get());
    }

    @Test
    void testIsTransient() {
        assertTrue(RetryingChatProvider.isTransient(new IOException("reset")));
        assertTrue(RetryingChatProvider.isTransient(new TimeoutException()));
        assertTrue(RetryingChatProvider.isTransient(new ProviderException("x", 502, null)));
        assertFalse(RetryingChatProvider.isTransient(new ProviderException("x", 400, null)));
        assertFalse(RetryingChatProvider.isTransient(new ProviderException("x")));
        assertFalse(RetryingChatProvider.isTransient(new IllegalStateException("bug")));
    }
}
