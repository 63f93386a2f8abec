package io.leavesfly.meer.engine;

import io.leavesfly.meer.engine.approval.EditReviewSession;
import io.leavesfly.meer.engine.approval.ProposedEdit;
import io.leavesfly.meer.engine.toolcall.ParsedResponse;
import io.leavesfly.meer.engine.toolcall.ToolCallParser;
import io.leavesfly.meer.engine.toolcall.ToolInvocation;
import io.leavesfly.meer.engine.toolcall.ToolObservation;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.message.Message;
import io.leavesfly.meer.tool.ToolKind;
import io.leavesfly.meer.tool.ToolRegistry;
import io.leavesfly.meer.tool.ToolResult;
import io.leavesfly.meer.wire.Wire;
import io.leavesfly.meer.wire.message.AssistantTextDelta;
import io.leavesfly.meer.wire.message.StepBegin;
import io.leavesfly.meer.wire.message.StepInterrupted;
import io.leavesfly.meer.wire.message.ToolCallBegin;
import io.leavesfly.meer.wire.message.ToolCallEnd;
import io.leavesfly.meer.wire.message.WireMessage;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Agent 循环
 * <p>
 * 职责：
 * - 把完整历史发给模型，解析响应中的工具调用
 * - 按文档顺序逐个执行工具，把观察结果作为 user 消息回填
 * - 判断终止：无工具调用、模型调用失败、重复调用、达到迭代上限
 * - 收集 propose_edit 产生的编辑，循环结束后交给审核会话
 * <p>
 * 超时只计算模型调用和工具执行阶段，不包含人工审核编辑的时间。
 * 超时或取消结束的运行不再征求审核，已收集的编辑全部记为 SKIPPED。
 * <p>
 * 单次使用：一个实例只运行一次。循环内部状态只在 Mono 链上顺序访问，无需加锁。
 */
@Slf4j
public class AgentLoop {

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final ChatProvider provider;
    private final ToolRegistry toolRegistry;
    private final List<Message> history;
    private final int maxIterations;
    private final String agentName;
    private final Wire wire;
    private final EditReviewSession reviewSession;
    private final BooleanSupplier cancellation;
    private final Duration timeout;

    private final AtomicBoolean timedOut = new AtomicBoolean(false);
    private final LoopSignatureTracker signatureTracker = new LoopSignatureTracker();
    private final List<ProposedEdit> proposedEdits = new CopyOnWriteArrayList<>();
    private final Set<String> toolsUsed = new LinkedHashSet<>();

    private volatile LoopState state = LoopState.IDLE;
    private int iterations;
    private int providerCalls;
    private int toolCallCount;

    /**
     * @param provider      模型提供商
     * @param toolRegistry  工具注册表（已绑定白名单）
     * @param history       消息历史，循环只追加；为 null 时新建
     * @param maxIterations 最大迭代次数，非正数时取默认值
     * @param agentName     子代理名称，主代理为 null
     * @param wire          UI 消息总线，可为 null
     * @param reviewSession 编辑审核会话，为 null 时只收集不审核
     * @param cancellation  取消令牌，为 null 时不可取消
     * @param timeout       迭代阶段的超时，为 null 或非正数时不限时
     */
    @Builder
    private AgentLoop(ChatProvider provider,
                      ToolRegistry toolRegistry,
                      List<Message> history,
                      int maxIterations,
                      String agentName,
                      Wire wire,
                      EditReviewSession reviewSession,
                      BooleanSupplier cancellation,
                      Duration timeout) {
        this.provider = provider;
        this.toolRegistry = toolRegistry;
        this.history = history != null ? history : new ArrayList<>();
        this.maxIterations = maxIterations > 0 ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.agentName = agentName;
        this.wire = wire;
        this.reviewSession = reviewSession;
        this.cancellation = cancellation != null ? cancellation : () -> false;
        this.timeout = timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : null;
    }

    /**
     * 运行循环
     *
     * @param userMessage 用户消息，追加到历史末尾
     * @return 终止结果；模型调用失败也以 ABORTED 结果返回，不以错误信号返回
     */
    public Mono<LoopResult> run(String userMessage) {
        return Mono.defer(() -> {
            if (state != LoopState.IDLE) {
                return Mono.error(new IllegalStateException("AgentLoop can only run once"));
            }
            state = LoopState.ITERATING;
            history.add(Message.user(userMessage));
            return withTimeout(iterate(1));
        }).flatMap(this::reviewEdits);
    }

    public LoopState getState() {
        return state;
    }

    public List<Message> getHistory() {
        return history;
    }

    private Mono<LoopResult> withTimeout(Mono<LoopResult> iterations) {
        if (timeout == null) {
            return iterations;
        }
        return iterations
                .timeout(timeout)
                .onErrorResume(TimeoutException.class, e -> {
                    timedOut.set(true);
                    return Mono.just(abort(LoopResult.AbortReason.TIMEOUT,
                            "Task timeout after " + timeout.toMillis() + "ms"));
                });
    }

    private boolean isStopped() {
        return timedOut.get() || cancellation.getAsBoolean();
    }

    private Mono<LoopResult> iterate(int step) {
        return Mono.defer(() -> {
            if (isStopped()) {
                return Mono.just(abort(LoopResult.AbortReason.CANCELLED, "Aborted by user"));
            }

            send(new StepBegin(step, agentName));

            return Mono.defer(this::callProvider)
                    .map(ProviderReply::success)
                    .onErrorResume(e -> Mono.just(ProviderReply.failure(e)))
                    .flatMap(reply -> {
                        if (reply.error != null) {
                            log.error("Provider call failed at step {}", step, reply.error);
                            return Mono.just(abort(LoopResult.AbortReason.PROVIDER_FAILURE,
                                    reply.error.getMessage()));
                        }
                        return handleResponse(step, reply.text);
                    });
        });
    }

    /**
     * 优先使用流式调用；流为空时退回非流式调用
     */
    private Mono<String> callProvider() {
        providerCalls++;
        List<Message> snapshot = List.copyOf(history);
        StringBuilder text = new StringBuilder();

        return provider.stream(snapshot)
                .doOnNext(chunk -> {
                    text.append(chunk);
                    send(new AssistantTextDelta(chunk, agentName));
                })
                .then(Mono.defer(() -> text.length() > 0
                        ? Mono.just(text.toString())
                        : provider.chat(snapshot).defaultIfEmpty("")));
    }

    private Mono<LoopResult> handleResponse(int step, String response) {
        ParsedResponse parsed = ToolCallParser.parse(response);

        if (!parsed.hasInvocations()) {
            history.add(Message.assistant(response));
            log.info("Agent loop completed at step {}", step);
            return Mono.just(finish(LoopState.COMPLETED, response));
        }

        String signature = LoopSignatureTracker.signatureOf(parsed.getInvocations());
        if (signatureTracker.checkAndRecord(signature)) {
            return Mono.just(abort(LoopResult.AbortReason.REPEATED_TOOL_CALLS,
                    "Repeated tool calls detected: " + signature));
        }

        return Flux.fromIterable(parsed.getInvocations())
                .concatMap(this::executeInvocation)
                .collectList()
                .flatMap(observations -> {
                    history.add(Message.assistant(response));
                    history.add(Message.user(renderObservations(observations)));
                    iterations++;

                    if (iterations >= maxIterations) {
                        log.warn("Agent loop reached iteration limit {}", maxIterations);
                        return Mono.just(finish(LoopState.ITERATION_LIMIT_REACHED,
                                annotateIncomplete(parsed, response)));
                    }
                    return iterate(step + 1);
                });
    }

    private Mono<ToolObservation> executeInvocation(ToolInvocation invocation) {
        return Mono.defer(() -> {
            String toolName = invocation.getToolName();
            if (isStopped()) {
                return Mono.just(new ToolObservation(toolName, "Cancelled before execution", true));
            }

            send(new ToolCallBegin(toolName, invocation.getParams(), agentName));
            return toolRegistry.execute(invocation)
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(result -> observe(invocation, result));
        });
    }

    private ToolObservation observe(ToolInvocation invocation, ToolResult result) {
        String toolName = invocation.getToolName();
        toolCallCount++;
        toolsUsed.add(toolName);

        if (ToolKind.of(toolName) == ToolKind.PROPOSE_EDIT && result.getProposedEdit() != null) {
            proposedEdits.add(result.getProposedEdit());
        }

        send(new ToolCallEnd(toolName, result.isError(), result.getMessage(), agentName));
        return new ToolObservation(toolName, result.toObservationText(), result.isError());
    }

    static String renderObservations(List<ToolObservation> observations) {
        return "Tool Results:\n\n" + observations.stream()
                .map(ToolObservation::render)
                .collect(Collectors.joining("\n\n"));
    }

    private String annotateIncomplete(ParsedResponse parsed, String response) {
        String lastText = parsed.getNarration().isEmpty() ? response : parsed.getNarration();
        return lastText + "\n\n[Incomplete: reached the iteration limit of " + maxIterations + "]";
    }

    private Mono<LoopResult> reviewEdits(LoopResult result) {
        if (reviewSession == null || proposedEdits.isEmpty()) {
            return Mono.just(result);
        }
        List<ProposedEdit> edits = List.copyOf(proposedEdits);
        if (result.isInterrupted()) {
            return Mono.just(result.toBuilder().reviewEntries(reviewSession.skipAll(edits)).build());
        }
        return Mono.fromCallable(() -> reviewSession.review(edits))
                .subscribeOn(Schedulers.boundedElastic())
                .map(entries -> result.toBuilder().reviewEntries(entries).build());
    }

    private LoopResult finish(LoopState terminal, String finalText) {
        state = terminal;
        return snapshot(terminal)
                .finalText(finalText)
                .build();
    }

    private LoopResult abort(LoopResult.AbortReason reason, String message) {
        state = LoopState.ABORTED;
        log.warn("Agent loop aborted ({}): {}", reason, message);
        send(new StepInterrupted(message, agentName));
        return snapshot(LoopState.ABORTED)
                .finalText("")
                .abortReason(reason)
                .errorMessage(message)
                .build();
    }

    private LoopResult.LoopResultBuilder snapshot(LoopState terminal) {
        return LoopResult.builder()
                .state(terminal)
                .iterations(iterations)
                .providerCalls(providerCalls)
                .toolCallCount(toolCallCount)
                .toolsUsed(new LinkedHashSet<>(toolsUsed))
                .proposedEdits(List.copyOf(proposedEdits));
    }

    private void send(WireMessage message) {
        if (wire != null) {
            wire.send(message);
        }
    }

    /**
     * 模型调用结果，把错误信号转换为普通值，避免后续步骤的错误被误判为模型调用失败
     */
    private static final class ProviderReply {
        private final String text;
        private final Throwable error;

        private ProviderReply(String text, Throwable error) {
            this.text = text;
            this.error = error;
        }

        static ProviderReply success(String text) {
            return new ProviderReply(text, null);
        }

        static ProviderReply failure(Throwable error) {
            return new ProviderReply(null, error);
        }
    }
}
