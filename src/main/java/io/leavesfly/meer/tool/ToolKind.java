package io.leavesfly.meer.tool;

/**
 * Agent 循环需要区别对待的工具种类
 * <p>
 * 只有读文件、列目录、提议修改三种是封闭集合，其余工具统一归为 EXTENSION，
 * 通过 ToolRegistry 的名称映射分发。
 */
public enum ToolKind {

    READ_FILE("read_file"),

    LIST_FILES("list_files"),

    /**
     * 产生 ProposedEdit，由编辑审核会话统一落盘
     */
    PROPOSE_EDIT("propose_edit"),

    EXTENSION(null);

    private final String toolName;

    ToolKind(String toolName) {
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    public static ToolKind of(String toolName) {
        for (ToolKind kind : values()) {
            if (kind.toolName != null && kind.toolName.equals(toolName)) {
                return kind;
            }
        }
        return EXTENSION;
    }
}
