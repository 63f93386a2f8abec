package io.leavesfly.meer.engine.subagent;

import lombok.Builder;
import lombok.Value;

/**
 * 子代理的实时状态快照，供 UI 轮询
 */
@Value
@Builder
public class SubAgentStatusInfo {

    String id;

    String agentName;

    SubAgentStatus status;

    /**
     * 基于耗时的估算进度（0-100），不是实际完成比例
     */
    int progress;

    String currentTask;

    long startTime;

    long elapsedMs;
}
