package io.leavesfly.meer.exception;

/**
 * Meer 异常基类
 * <p>
 * 委派阶段的错误（查找、校验）以异常形式抛出；
 * 执行阶段的错误统一收敛到 ToolResult / LoopResult / SubAgentResult 中。
 */
public class MeerException extends RuntimeException {

    public MeerException(String message) {
        super(message);
    }

    public MeerException(String message, Throwable cause) {
        super(message, cause);
    }
}
