package io.leavesfly.meer.engine.subagent;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.engine.AgentLoop;
import io.leavesfly.meer.engine.LoopResult;
import io.leavesfly.meer.engine.PromptRenderer;
import io.leavesfly.meer.engine.approval.EditReviewSession;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.message.Message;
import io.leavesfly.meer.tool.ToolFilter;
import io.leavesfly.meer.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 子代理
 * <p>
 * 职责：
 * - 以 Agent 定义的正文为系统提示词，在独立的消息历史中运行一次 Agent 循环
 * - 工具集按定义中的白名单过滤，不包含 delegate_task
 * - 把循环结果转换为 SubAgentResult，执行期间的错误一律记录在结果中
 * <p>
 * 每个实例只执行一次。abort() 会把状态置为 FAILED 并触发取消令牌，
 * 循环在下一次模型调用或工具执行之前停止，尚未审核的编辑不再写盘。
 */
@Slf4j
public class SubAgent {

    static final int SUMMARY_LIMIT = 500;
    static final String TRUNCATION_MARKER = "\n[... output truncated ...]";
    static final int CHARS_PER_TOKEN = 4;
    static final long PROGRESS_WINDOW_MS = 30_000L;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final String id;
    private final AgentDefinition definition;
    private final AgentExecutionConfig config;

    private final AtomicReference<SubAgentStatus> status = new AtomicReference<>(SubAgentStatus.IDLE);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile long startTime;
    private volatile String currentTask;

    public SubAgent(AgentDefinition definition, AgentExecutionConfig config) {
        this.id = generateId();
        this.definition = definition;
        this.config = config;
    }

    public Mono<SubAgentResult> execute(String task, ExecutionContext context) {
        return execute(task, context, 0);
    }

    /**
     * 执行任务
     *
     * @param task      任务描述
     * @param context   执行上下文，可为 null
     * @param timeoutMs 模型调用和工具执行阶段的超时，非正数表示不限时；编辑审核不计入
     * @return 执行结果，不会以错误信号结束
     */
    public Mono<SubAgentResult> execute(String task, ExecutionContext context, long timeoutMs) {
        ExecutionContext ctx = context != null ? context : ExecutionContext.empty();
        return Mono.defer(() -> {
            if (!status.compareAndSet(SubAgentStatus.IDLE, SubAgentStatus.RUNNING)) {
                return Mono.just(rejectRerun());
            }
            startTime = System.currentTimeMillis();
            currentTask = task;
            log.info("Sub-agent {} ({}) started", definition.getName(), id);

            AgentLoop loop = buildLoop(ctx, timeoutMs);
            return loop.run(buildTaskMessage(task, ctx)).map(this::toResult);
        }).onErrorResume(e -> {
            log.error("Sub-agent {} ({}) failed", definition.getName(), id, e);
            status.set(SubAgentStatus.FAILED);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Mono.just(SubAgentResult.failure(definition.getName(), message,
                    SubAgentResult.FailureType.EXECUTION_ERROR, elapsed()));
        });
    }

    /**
     * 中止执行
     */
    public void abort() {
        cancelled.set(true);
        SubAgentStatus previous = status.getAndSet(SubAgentStatus.FAILED);
        if (previous == SubAgentStatus.RUNNING) {
            log.info("Sub-agent {} ({}) aborted", definition.getName(), id);
        }
    }

    public SubAgentStatusInfo getStatusInfo() {
        SubAgentStatus current = status.get();
        long elapsed = current == SubAgentStatus.IDLE ? 0 : elapsed();
        return SubAgentStatusInfo.builder()
                .id(id)
                .agentName(definition.getName())
                .status(current)
                .progress(estimateProgress(current, elapsed))
                .currentTask(currentTask)
                .startTime(startTime)
                .elapsedMs(elapsed)
                .build();
    }

    public String getId() {
        return id;
    }

    public AgentDefinition getDefinition() {
        return definition;
    }

    public SubAgentStatus getStatus() {
        return status.get();
    }

    private AgentLoop buildLoop(ExecutionContext ctx, long timeoutMs) {
        ChatProvider provider = definition.inheritsModel()
                ? config.getDefaultProvider()
                : config.resolveProvider(definition.getModel());
        if (definition.getTemperature() != null) {
            provider = provider.withTemperature(definition.getTemperature());
        }

        ToolFilter filter = new ToolFilter(definition.getName(), definition.getAllowedTools());
        ToolRegistry registry = config.getToolRegistryFactory()
                .createStandardRegistry(config.getWorkDir(), filter, config.getCommandConfirmation());

        List<Message> history = new ArrayList<>();
        history.add(Message.system(buildSystemPrompt(registry, ctx)));

        EditReviewSession reviewSession = null;
        if (config.getEditApprover() != null && config.getEditApplier() != null) {
            reviewSession = new EditReviewSession(config.getEditApprover(), config.getEditApplier(),
                    config.getDiffRenderer(), cancelled::get);
        }

        return AgentLoop.builder()
                .provider(provider)
                .toolRegistry(registry)
                .history(history)
                .maxIterations(resolveMaxIterations())
                .agentName(definition.getName())
                .wire(config.getWire())
                .reviewSession(reviewSession)
                .cancellation(cancelled::get)
                .timeout(timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null)
                .build();
    }

    int resolveMaxIterations() {
        if (definition.getMaxIterations() != null && definition.getMaxIterations() > 0) {
            return definition.getMaxIterations();
        }
        if (config.getDefaultMaxIterations() > 0) {
            return config.getDefaultMaxIterations();
        }
        return AgentLoop.DEFAULT_MAX_ITERATIONS;
    }

    private String buildSystemPrompt(ToolRegistry registry, ExecutionContext ctx) {
        StringBuilder sb = new StringBuilder(definition.getSystemPrompt());
        sb.append("\n\n").append(PromptRenderer.renderToolSection(registry));
        sb.append(renderContextBlock(ctx.getMetadata()));
        return sb.toString();
    }

    static String renderContextBlock(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\n## Context");
        metadata.forEach((key, value) -> sb.append("\n- ").append(key).append(": ").append(value));
        return sb.toString();
    }

    static String buildTaskMessage(String task, ExecutionContext ctx) {
        StringBuilder sb = new StringBuilder(task);
        if (ctx.getFiles() != null && !ctx.getFiles().isEmpty()) {
            sb.append("\n\n## Relevant Files");
            ctx.getFiles().forEach(file -> sb.append("\n- ").append(file));
        }
        if (ctx.getCwd() != null && !ctx.getCwd().isEmpty()) {
            sb.append("\n\n## Working Directory\n").append(ctx.getCwd());
        }
        return sb.toString();
    }

    private SubAgentResult toResult(LoopResult loopResult) {
        long duration = elapsed();
        String agentName = definition.getName();

        if (cancelled.get() || loopResult.isAborted()) {
            status.set(SubAgentStatus.FAILED);
            SubAgentResult.FailureType type;
            String message;
            LoopResult.AbortReason reason = cancelled.get()
                    ? LoopResult.AbortReason.CANCELLED
                    : loopResult.getAbortReason();
            switch (reason) {
                case PROVIDER_FAILURE:
                    type = SubAgentResult.FailureType.PROVIDER_FAILURE;
                    message = "Provider failure: " + loopResult.getErrorMessage();
                    break;
                case REPEATED_TOOL_CALLS:
                    type = SubAgentResult.FailureType.REPEATED_TOOL_CALLS;
                    message = "Stopped: repeated identical tool calls";
                    break;
                case TIMEOUT:
                    type = SubAgentResult.FailureType.TIMEOUT;
                    message = loopResult.getErrorMessage();
                    break;
                default:
                    type = SubAgentResult.FailureType.CANCELLED;
                    message = "Aborted by user";
                    break;
            }
            log.warn("Sub-agent {} ({}) ended without result: {}", agentName, id, message);
            SubAgentResult failure = SubAgentResult.failure(agentName, message, type, duration);
            return failure.toBuilder()
                    .metadata(SubAgentResult.Metadata.builder()
                            .durationMs(duration)
                            .toolCallCount(loopResult.getToolCallCount())
                            .toolsUsed(new ArrayList<>(loopResult.getToolsUsed()))
                            .errors(failure.getMetadata().getErrors())
                            .build())
                    .editReview(loopResult.getReviewEntries())
                    .build();
        }

        status.compareAndSet(SubAgentStatus.RUNNING, SubAgentStatus.COMPLETED);
        String output = loopResult.getFinalText() != null ? loopResult.getFinalText() : "";
        List<String> errors = new ArrayList<>();
        if (loopResult.isIterationLimitReached()) {
            errors.add("Reached iteration limit of " + resolveMaxIterations());
        }
        log.info("Sub-agent {} ({}) completed in {}ms with {} tool call(s)",
                agentName, id, duration, loopResult.getToolCallCount());

        return SubAgentResult.builder()
                .success(true)
                .agentName(agentName)
                .output(output)
                .summary(summarize(output))
                .metadata(SubAgentResult.Metadata.builder()
                        .durationMs(duration)
                        .tokensUsed(estimateTokens(output))
                        .toolCallCount(loopResult.getToolCallCount())
                        .toolsUsed(new ArrayList<>(loopResult.getToolsUsed()))
                        .errors(errors)
                        .build())
                .editReview(loopResult.getReviewEntries())
                .build();
    }

    private SubAgentResult rejectRerun() {
        if (cancelled.get()) {
            return SubAgentResult.failure(definition.getName(), "Aborted by user",
                    SubAgentResult.FailureType.CANCELLED);
        }
        return SubAgentResult.failure(definition.getName(), "Sub-agent " + id + " has already been executed",
                SubAgentResult.FailureType.EXECUTION_ERROR);
    }

    /**
     * 截取输出的前若干个非空行作为摘要；首行超长时直接截断
     */
    static String summarize(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        StringBuilder summary = new StringBuilder();
        boolean truncated = false;
        for (String line : output.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            int separator = summary.length() == 0 ? 0 : 1;
            if (summary.length() + separator + line.length() > SUMMARY_LIMIT) {
                if (summary.length() == 0) {
                    summary.append(line, 0, SUMMARY_LIMIT);
                }
                truncated = true;
                break;
            }
            if (separator > 0) {
                summary.append('\n');
            }
            summary.append(line);
        }
        if (truncated) {
            summary.append(TRUNCATION_MARKER);
        }
        return summary.toString();
    }

    static int estimateTokens(String output) {
        return (output.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    static int estimateProgress(SubAgentStatus status, long elapsedMs) {
        if (status == SubAgentStatus.IDLE) {
            return 0;
        }
        if (status.isTerminal()) {
            return 100;
        }
        return (int) Math.min(95, elapsedMs * 100 / PROGRESS_WINDOW_MS);
    }

    private long elapsed() {
        return startTime == 0 ? 0 : System.currentTimeMillis() - startTime;
    }

    private static String generateId() {
        StringBuilder sb = new StringBuilder("agent_");
        for (int i = 0; i < 8; i++) {
            sb.append(String.format("%02x", RANDOM.nextInt(256)));
        }
        return sb.toString();
    }
}
