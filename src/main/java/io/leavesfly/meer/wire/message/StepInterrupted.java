package io.leavesfly.meer.wire.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 循环异常终止
 */
@Getter
@AllArgsConstructor
public class StepInterrupted implements WireMessage {

    private final String reason;

    private final String agentName;
}
