package io.leavesfly.meer.engine;

/**
 * Agent 循环状态
 * IDLE → ITERATING → {COMPLETED | ABORTED | ITERATION_LIMIT_REACHED}
 */
public enum LoopState {

    IDLE,

    ITERATING,

    /**
     * 模型给出了不含工具调用的最终回答
     */
    COMPLETED,

    ABORTED,

    ITERATION_LIMIT_REACHED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == ITERATION_LIMIT_REACHED;
    }
}
