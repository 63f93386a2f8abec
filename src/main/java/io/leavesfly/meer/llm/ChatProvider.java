package io.leavesfly.meer.llm;

import io.leavesfly.meer.llm.message.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * LLM 提供商接口
 * <p>
 * Agent 循环只依赖这两个方法；重试、限流等韧性逻辑由包装实现负责。
 */
public interface ChatProvider {

    /**
     * 非流式调用，返回完整响应文本
     */
    Mono<String> chat(List<Message> history);

    /**
     * 流式调用，返回增量文本块
     */
    Flux<String> stream(List<Message> history);

    /**
     * 模型名称
     */
    String getModelName();

    /**
     * 返回使用指定温度的提供商，不支持温度的实现返回自身
     */
    default ChatProvider withTemperature(Double temperature) {
        return this;
    }
}
