package io.leavesfly.meer.engine.subagent;

/**
 * 子代理状态
 */
public enum SubAgentStatus {

    IDLE,

    RUNNING,

    COMPLETED,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
