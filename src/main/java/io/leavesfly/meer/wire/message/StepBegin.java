package io.leavesfly.meer.wire.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次迭代开始
 */
@Getter
@AllArgsConstructor
public class StepBegin implements WireMessage {

    private final int stepNumber;

    private final String agentName;
}
