package io.leavesfly.meer.engine.toolcall;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 解析结果：首个工具调用之前的说明文本 + 按文档顺序排列的工具调用
 */
@Getter
@AllArgsConstructor
public class ParsedResponse {

    private final String narration;

    private final List<ToolInvocation> invocations;

    public boolean hasInvocations() {
        return !invocations.isEmpty();
    }
}
