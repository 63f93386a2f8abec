package io.leavesfly.meer.wire;

import io.leavesfly.meer.wire.message.WireMessage;
import reactor.core.publisher.Flux;

/**
 * Wire 消息总线接口
 * 用于 Agent 循环和 UI 之间的解耦通信
 */
public interface Wire {

    void send(WireMessage message);

    Flux<WireMessage> asFlux();

    void complete();
}
