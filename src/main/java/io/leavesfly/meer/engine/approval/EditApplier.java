package io.leavesfly.meer.engine.approval;

import io.leavesfly.meer.tool.ToolResult;

/**
 * 编辑落盘原语
 */
@FunctionalInterface
public interface EditApplier {

    /**
     * 将编辑写入磁盘
     *
     * @return 成功或失败结果，不抛出异常
     */
    ToolResult apply(ProposedEdit edit);
}
