package io.leavesfly.meer.exception;

/**
 * 指定名称的 Agent 已被禁用
 */
public class AgentDisabledException extends MeerException {

    public AgentDisabledException(String message) {
        super(message);
    }
}
