package io.leavesfly.meer.tool;

import io.leavesfly.meer.engine.approval.ProposedEdit;
import lombok.Getter;

/**
 * 工具执行结果
 * <p>
 * output 是回填给模型的主体内容，message 是简短说明。
 * 错误结果不会中断 Agent 循环，而是作为观察结果交给模型自行修正。
 */
@Getter
public class ToolResult {

    private final boolean error;
    private final String output;
    private final String message;
    private final ProposedEdit proposedEdit;

    private ToolResult(boolean error, String output, String message, ProposedEdit proposedEdit) {
        this.error = error;
        this.output = output != null ? output : "";
        this.message = message != null ? message : "";
        this.proposedEdit = proposedEdit;
    }

    public static ToolResult ok(String output, String message) {
        return new ToolResult(false, output, message, null);
    }

    public static ToolResult error(String message) {
        return new ToolResult(true, "", message, null);
    }

    public static ToolResult error(String output, String message) {
        return new ToolResult(true, output, message, null);
    }

    /**
     * 携带编辑提议的成功结果
     */
    public static ToolResult proposed(ProposedEdit edit, String message) {
        return new ToolResult(false, "", message, edit);
    }

    /**
     * 渲染为观察文本
     */
    public String toObservationText() {
        if (error) {
            return output.isEmpty() ? message : message + "\n" + output;
        }
        return output.isEmpty() ? message : output;
    }
}
