package io.leavesfly.meer.tool.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import io.leavesfly.meer.engine.approval.EditReviewEntry;
import io.leavesfly.meer.engine.subagent.ExecutionContext;
import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.orchestrator.DelegationOptions;
import io.leavesfly.meer.tool.AbstractTool;
import io.leavesfly.meer.tool.ToolResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * delegate_task 工具 - 把子任务委托给专门的子代理
 * <p>
 * 子代理拥有独立的消息历史，只把输出摘要返回给主代理。
 * 仅注册在主代理的工具集中。
 */
@Slf4j
public class DelegateTask extends AbstractTool<DelegateTask.Params> {

    private final AgentOrchestrator orchestrator;
    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "agent", required = true)
        @JsonPropertyDescription("子代理名称，必须是可用子代理列表中的一个")
        private String agent;

        @JsonProperty(value = "task", required = true)
        @JsonPropertyDescription("交给子代理的完整任务说明，需包含独立完成任务所需的背景")
        private String task;

        @JsonProperty("timeout")
        @JsonPropertyDescription("超时秒数，默认使用配置值")
        private Integer timeout;
    }

    public DelegateTask(AgentOrchestrator orchestrator, Path workDir) {
        super("delegate_task", "把一个独立的子任务委托给专门的子代理，返回其结果摘要。", Params.class);
        this.orchestrator = orchestrator;
        this.workDir = workDir;
    }

    @Override
    public String getBodyDescription() {
        return "可选，附加到任务说明后的补充内容";
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        if (params.getAgent() == null || params.getAgent().isBlank()) {
            return Mono.just(ToolResult.error("Parameter `agent` is required."));
        }
        if (params.getTask() == null || params.getTask().isBlank()) {
            return Mono.just(ToolResult.error("Parameter `task` is required."));
        }

        String task = body == null || body.isBlank() ? params.getTask() : params.getTask() + "\n\n" + body;
        DelegationOptions options = DelegationOptions.builder()
                .timeoutMs(params.getTimeout() != null ? params.getTimeout() * 1000L : null)
                .context(ExecutionContext.builder().cwd(workDir.toString()).build())
                .build();

        Mono<SubAgentResult> delegation;
        try {
            delegation = orchestrator.delegateTask(params.getAgent(), task, options);
        } catch (MeerException e) {
            log.warn("Delegation to {} rejected: {}", params.getAgent(), e.getMessage());
            return Mono.just(ToolResult.error(e.getMessage()));
        }
        return delegation.map(this::toToolResult);
    }

    private ToolResult toToolResult(SubAgentResult result) {
        if (!result.isSuccess()) {
            return ToolResult.error(String.format("Sub-agent `%s` failed: %s", result.getAgentName(), result.getError()));
        }

        StringBuilder output = new StringBuilder();
        output.append("Sub-agent `").append(result.getAgentName()).append("` finished.\n\n");
        output.append(result.getSummary());
        if (!result.getEditReview().isEmpty()) {
            output.append("\n\nEdits:");
            for (EditReviewEntry entry : result.getEditReview()) {
                output.append("\n- ").append(entry.getPath()).append(": ").append(entry.getDisposition());
            }
        }
        return ToolResult.ok(output.toString(), "Delegated to " + result.getAgentName());
    }
}
