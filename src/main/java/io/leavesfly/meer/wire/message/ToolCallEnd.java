package io.leavesfly.meer.wire.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 工具调用结束
 */
@Getter
@AllArgsConstructor
public class ToolCallEnd implements WireMessage {

    private final String toolName;

    private final boolean error;

    /**
     * 结果的简短说明
     */
    private final String brief;

    private final String agentName;
}
