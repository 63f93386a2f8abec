package io.leavesfly.meer.engine.approval;

/**
 * 用户对单个编辑的审核决定
 */
public enum EditDecision {

    /**
     * 应用当前编辑
     */
    APPLY,

    /**
     * 跳过当前编辑
     */
    SKIP,

    /**
     * 应用当前及后续所有编辑，不再询问
     */
    APPLY_ALL,

    /**
     * 跳过当前及后续所有编辑，不再询问
     */
    SKIP_ALL;

    public boolean isApply() {
        return this == APPLY || this == APPLY_ALL;
    }

    public boolean isBulk() {
        return this == APPLY_ALL || this == SKIP_ALL;
    }
}
