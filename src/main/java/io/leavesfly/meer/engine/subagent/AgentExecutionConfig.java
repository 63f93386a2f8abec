package io.leavesfly.meer.engine.subagent;

import io.leavesfly.meer.engine.AgentLoop;
import io.leavesfly.meer.engine.approval.DiffRenderer;
import io.leavesfly.meer.engine.approval.EditApplier;
import io.leavesfly.meer.engine.approval.EditApprover;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import io.leavesfly.meer.wire.Wire;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * 子代理执行所需的共享依赖
 * <p>
 * 由编排器持有并传给每个 SubAgent；所有字段只读。
 */
@Getter
@Builder
public class AgentExecutionConfig {

    /**
     * 主代理使用的提供商，model 为 inherit 时使用
     */
    private final ChatProvider defaultProvider;

    /**
     * 按模型名解析提供商，为 null 时所有子代理都使用 defaultProvider
     */
    private final Function<String, ChatProvider> modelResolver;

    private final ToolRegistryFactory toolRegistryFactory;

    private final Path workDir;

    @Builder.Default
    private final int defaultMaxIterations = AgentLoop.DEFAULT_MAX_ITERATIONS;

    @Builder.Default
    private final long defaultTimeoutMs = 60_000L;

    /**
     * 为 null 时子代理的编辑只收集不落盘
     */
    private final EditApprover editApprover;

    private final EditApplier editApplier;

    @Builder.Default
    private final DiffRenderer diffRenderer = new DiffRenderer();

    @Builder.Default
    private final CommandConfirmation commandConfirmation = CommandConfirmation.never();

    private final Wire wire;

    public ChatProvider resolveProvider(String model) {
        if (modelResolver == null) {
            return defaultProvider;
        }
        return modelResolver.apply(model);
    }
}
