package io.leavesfly.meer.engine;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 主代理一轮对话的结果
 */
@Getter
@AllArgsConstructor
public class TurnResult {

    private final LoopResult loopResult;

    /**
     * 面向用户的失败说明，正常完成时为 null
     */
    private final String notice;

    public boolean hasNotice() {
        return notice != null;
    }
}
