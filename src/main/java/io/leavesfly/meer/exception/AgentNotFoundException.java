package io.leavesfly.meer.exception;

/**
 * 指定名称的 Agent 不存在
 */
public class AgentNotFoundException extends MeerException {

    public AgentNotFoundException(String message) {
        super(message);
    }
}
