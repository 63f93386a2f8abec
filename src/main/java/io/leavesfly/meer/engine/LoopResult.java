package io.leavesfly.meer.engine;

import io.leavesfly.meer.engine.approval.EditReviewEntry;
import io.leavesfly.meer.engine.approval.ProposedEdit;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 一次 Agent 循环运行的结果
 */
@Getter
@Builder(toBuilder = true)
public class LoopResult {

    /**
     * 终止原因
     */
    public enum AbortReason {
        PROVIDER_FAILURE,
        REPEATED_TOOL_CALLS,
        CANCELLED,
        TIMEOUT
    }

    private final LoopState state;

    /**
     * 最终回答；达到迭代上限时附带未完成标注
     */
    private final String finalText;

    private final AbortReason abortReason;

    private final String errorMessage;

    private final int iterations;

    private final int providerCalls;

    private final int toolCallCount;

    @Builder.Default
    private final Set<String> toolsUsed = Collections.emptySet();

    @Builder.Default
    private final List<ProposedEdit> proposedEdits = Collections.emptyList();

    /**
     * 编辑审核摘要，未运行审核时为空
     */
    @Builder.Default
    private final List<EditReviewEntry> reviewEntries = Collections.emptyList();

    public boolean isCompleted() {
        return state == LoopState.COMPLETED;
    }

    public boolean isAborted() {
        return state == LoopState.ABORTED;
    }

    /**
     * 被取消或超时中断，此时不再征求编辑审核
     */
    public boolean isInterrupted() {
        return abortReason == AbortReason.CANCELLED || abortReason == AbortReason.TIMEOUT;
    }

    public boolean isIterationLimitReached() {
        return state == LoopState.ITERATION_LIMIT_REACHED;
    }
}
