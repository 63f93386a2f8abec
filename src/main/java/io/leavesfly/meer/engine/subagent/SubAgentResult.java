package io.leavesfly.meer.engine.subagent;

import io.leavesfly.meer.engine.approval.EditReviewEntry;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 子代理执行结果
 * <p>
 * 执行期间的任何错误都体现在结果中，而不是以异常抛出。
 */
@Getter
@Builder(toBuilder = true)
public class SubAgentResult {

    /**
     * 失败类型，供调用方决定是否重试
     */
    public enum FailureType {
        EXECUTION_ERROR,
        PROVIDER_FAILURE,
        REPEATED_TOOL_CALLS,
        CANCELLED,
        TIMEOUT,
        DELEGATION_ERROR
    }

    private final boolean success;

    private final String agentName;

    @Builder.Default
    private final String output = "";

    /**
     * 有界长度的摘要，用于汇总报告
     */
    @Builder.Default
    private final String summary = "";

    private final String error;

    private final FailureType failureType;

    private final Metadata metadata;

    @Builder.Default
    private final List<EditReviewEntry> editReview = Collections.emptyList();

    /**
     * 执行度量
     */
    @Getter
    @Builder
    public static class Metadata {

        private final long durationMs;

        private final int tokensUsed;

        private final int toolCallCount;

        @Builder.Default
        private final List<String> toolsUsed = Collections.emptyList();

        @Builder.Default
        private final List<String> errors = Collections.emptyList();
    }

    public boolean isTimeout() {
        return failureType == FailureType.TIMEOUT;
    }

    /**
     * 构造失败结果
     */
    public static SubAgentResult failure(String agentName, String message, FailureType type, long durationMs) {
        List<String> errors = new ArrayList<>();
        errors.add(message);
        return SubAgentResult.builder()
                .success(false)
                .agentName(agentName)
                .output("")
                .summary("Failed: " + message)
                .error(message)
                .failureType(type)
                .metadata(Metadata.builder()
                        .durationMs(durationMs)
                        .errors(errors)
                        .build())
                .build();
    }

    public static SubAgentResult failure(String agentName, String message, FailureType type) {
        return failure(agentName, message, type, 0);
    }
}
