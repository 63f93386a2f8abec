package io.leavesfly.meer.wire;

import io.leavesfly.meer.wire.message.WireMessage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 基于 Sinks 的 Wire 实现
 * <p>
 * 多个子代理可能并发发送，send 做了串行化；
 * 没有订阅者时消息直接丢弃。
 */
@Slf4j
public class WireImpl implements Wire {

    private final Sinks.Many<WireMessage> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public synchronized void send(WireMessage message) {
        Sinks.EmitResult result = sink.tryEmitNext(message);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped wire message {}: {}", message.getClass().getSimpleName(), result);
        }
    }

    @Override
    public Flux<WireMessage> asFlux() {
        return sink.asFlux();
    }

    @Override
    public synchronized void complete() {
        sink.tryEmitComplete();
    }
}
