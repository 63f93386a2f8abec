package io.leavesfly.meer.orchestrator;

import io.leavesfly.meer.engine.subagent.ExecutionContext;
import lombok.Builder;
import lombok.Getter;

/**
 * 委托选项
 */
@Getter
@Builder
public class DelegationOptions {

    /**
     * 超时毫秒数，为 null 或非正数时使用配置的默认值
     */
    private final Long timeoutMs;

    @Builder.Default
    private final ExecutionContext context = ExecutionContext.empty();

    public static DelegationOptions defaults() {
        return DelegationOptions.builder().build();
    }

    public static DelegationOptions withTimeout(long timeoutMs) {
        return DelegationOptions.builder().timeoutMs(timeoutMs).build();
    }
}
