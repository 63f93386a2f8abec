package io.leavesfly.meer.exception;

/**
 * Agent 定义文件解析或写入失败
 */
public class AgentDefinitionException extends MeerException {

    public AgentDefinitionException(String message) {
        super(message);
    }

    public AgentDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
