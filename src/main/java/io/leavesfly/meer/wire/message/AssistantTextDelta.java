package io.leavesfly.meer.wire.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 模型流式输出的文本增量
 */
@Getter
@AllArgsConstructor
public class AssistantTextDelta implements WireMessage {

    private final String text;

    private final String agentName;
}
