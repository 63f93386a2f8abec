package io.leavesfly.meer.wire.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * 工具调用开始
 */
@Getter
@AllArgsConstructor
public class ToolCallBegin implements WireMessage {

    private final String toolName;

    private final Map<String, String> params;

    private final String agentName;
}
