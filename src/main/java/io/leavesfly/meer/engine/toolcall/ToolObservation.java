package io.leavesfly.meer.engine.toolcall;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 工具执行结果，作为合成的 user 消息回填到历史中
 */
@Data
@AllArgsConstructor
public class ToolObservation {

    private String toolName;

    private String resultText;

    private boolean error;

    /**
     * 回填给模型的文本块
     */
    public String render() {
        return "Tool: " + toolName + "\n" + (error ? "Error: " : "Result: ") + resultText;
    }
}
