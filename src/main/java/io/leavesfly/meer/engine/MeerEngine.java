package io.leavesfly.meer.engine;

import io.leavesfly.meer.engine.approval.DiffRenderer;
import io.leavesfly.meer.engine.approval.EditApplier;
import io.leavesfly.meer.engine.approval.EditApprover;
import io.leavesfly.meer.engine.approval.EditReviewSession;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.message.Message;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.tool.ToolRegistry;
import io.leavesfly.meer.wire.Wire;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MeerEngine - 主代理
 * <p>
 * 职责：
 * - 跨轮次保存对话历史，首轮渲染系统提示词
 * - 每条用户消息运行一次 AgentLoop，工具集包含 delegate_task
 * - 为三种致命终止情况分别给出面向用户的说明
 */
@Slf4j
public class MeerEngine {

    private final ChatProvider provider;
    private final ToolRegistry toolRegistry;
    private final AgentOrchestrator orchestrator;
    private final Path workDir;
    private final int maxIterations;
    private final Wire wire;
    private final EditApprover editApprover;
    private final EditApplier editApplier;
    private final DiffRenderer diffRenderer;

    private final List<Message> history = Collections.synchronizedList(new ArrayList<>());

    /**
     * @param editApprover 为 null 时（dry-run）编辑只收集不落盘
     */
    @Builder
    private MeerEngine(ChatProvider provider,
                       ToolRegistry toolRegistry,
                       AgentOrchestrator orchestrator,
                       Path workDir,
                       int maxIterations,
                       Wire wire,
                       EditApprover editApprover,
                       EditApplier editApplier,
                       DiffRenderer diffRenderer) {
        this.provider = provider;
        this.toolRegistry = toolRegistry;
        this.orchestrator = orchestrator;
        this.workDir = workDir;
        this.maxIterations = maxIterations > 0 ? maxIterations : AgentLoop.DEFAULT_MAX_ITERATIONS;
        this.wire = wire;
        this.editApprover = editApprover;
        this.editApplier = editApplier;
        this.diffRenderer = diffRenderer != null ? diffRenderer : new DiffRenderer();
    }

    /**
     * 处理一条用户消息
     */
    public Mono<TurnResult> run(String userInput) {
        return Mono.defer(() -> {
            if (history.isEmpty()) {
                history.add(Message.system(PromptRenderer.renderMainPrompt(workDir, toolRegistry,
                        orchestrator != null ? orchestrator.listEnabledAgents() : List.of())));
            }

            EditReviewSession reviewSession = editApprover != null && editApplier != null
                    ? new EditReviewSession(editApprover, editApplier, diffRenderer)
                    : null;

            AgentLoop loop = AgentLoop.builder()
                    .provider(provider)
                    .toolRegistry(toolRegistry)
                    .history(history)
                    .maxIterations(maxIterations)
                    .wire(wire)
                    .reviewSession(reviewSession)
                    .build();

            return loop.run(userInput)
                    .map(result -> new TurnResult(result, describeFailure(result, maxIterations)));
        });
    }

    /**
     * 致命终止情况对应的用户提示；正常完成返回 null
     */
    static String describeFailure(LoopResult result, int maxIterations) {
        if (result.isIterationLimitReached()) {
            return "Reached the iteration limit (" + maxIterations
                    + "). Raise loop_control.max_iterations to continue.";
        }
        if (!result.isAborted()) {
            return null;
        }
        switch (result.getAbortReason()) {
            case PROVIDER_FAILURE:
                return "Provider request failed: " + result.getErrorMessage()
                        + ". Check your API key and base URL.";
            case REPEATED_TOOL_CALLS:
                return "The assistant got stuck repeating the same tool calls. Try rephrasing the task.";
            default:
                return "Interrupted.";
        }
    }

    /**
     * 清空对话历史，下一轮重新渲染系统提示词
     */
    public void reset() {
        history.clear();
        log.info("Conversation history cleared");
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("model", provider.getModelName());
        status.put("workDir", workDir.toString());
        status.put("messageCount", history.size());
        status.put("maxIterations", maxIterations);
        status.put("tools", toolRegistry.getToolNames());
        status.put("activeSubAgents", orchestrator != null ? orchestrator.getAllActiveAgents().size() : 0);
        return status;
    }

    public String getModel() {
        return provider.getModelName();
    }

    public Wire getWire() {
        return wire;
    }

    public AgentOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public List<Message> getHistory() {
        return history;
    }
}
