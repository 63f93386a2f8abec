package io.leavesfly.meer.llm;

import io.leavesfly.meer.config.RetryConfig;
import io.leavesfly.meer.exception.ProviderException;
import io.leavesfly.meer.llm.message.Message;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * 带指数退避重试的 ChatProvider 包装器
 * <p>
 * 只重试瞬时错误（网络、429、5xx）；流式调用仅在尚未产出任何文本块时重试，
 * 避免重复输出。重试耗尽后抛出最后一次的原始错误。
 */
@Slf4j
public class RetryingChatProvider implements ChatProvider {

    private final ChatProvider delegate;
    private final RetryConfig retryConfig;

    public RetryingChatProvider(ChatProvider delegate, RetryConfig retryConfig) {
        this.delegate = delegate;
        this.retryConfig = retryConfig;
    }

    @Override
    public Mono<String> chat(List<Message> history) {
        if (retryConfig.getMaxAttempts() <= 0) {
            return delegate.chat(history);
        }
        return delegate.chat(history).retryWhen(retrySpec(() -> true));
    }

    @Override
    public Flux<String> stream(List<Message> history) {
        if (retryConfig.getMaxAttempts() <= 0) {
            return delegate.stream(history);
        }
        return Flux.defer(() -> {
            AtomicBoolean emitted = new AtomicBoolean(false);
            return delegate.stream(history)
                    .doOnNext(chunk -> emitted.set(true))
                    .retryWhen(retrySpec(() -> !emitted.get()));
        });
    }

    @Override
    public String getModelName() {
        return delegate.getModelName();
    }

    @Override
    public ChatProvider withTemperature(Double temperature) {
        ChatProvider adjusted = delegate.withTemperature(temperature);
        return adjusted == delegate ? this : new RetryingChatProvider(adjusted, retryConfig);
    }

    private Retry retrySpec(BooleanSupplier stillRetryable) {
        return Retry.backoff(retryConfig.getMaxAttempts(), Duration.ofMillis(retryConfig.getInitialBackoffMs()))
                .maxBackoff(Duration.ofMillis(retryConfig.getMaxBackoffMs()))
                .filter(e -> isTransient(e) && stillRetryable.getAsBoolean())
                .doBeforeRetry(signal -> log.warn("Retrying {} after transient failure (attempt {}/{}): {}",
                        delegate.getModelName(), signal.totalRetries() + 1, retryConfig.getMaxAttempts(),
                        signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof ProviderException providerException) {
            return providerException.isTransient();
        }
        return e instanceof IOException || e instanceof TimeoutException;
    }
}
