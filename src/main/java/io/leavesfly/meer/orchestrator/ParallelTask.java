package io.leavesfly.meer.orchestrator;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 并行委托中的单个任务
 */
@Getter
@AllArgsConstructor
public class ParallelTask {

    private final String agentName;

    private final String task;

    private final DelegationOptions options;

    public ParallelTask(String agentName, String task) {
        this(agentName, task, DelegationOptions.defaults());
    }
}
