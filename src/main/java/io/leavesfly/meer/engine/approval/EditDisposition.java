package io.leavesfly.meer.engine.approval;

/**
 * 编辑的最终处置
 */
public enum EditDisposition {

    /**
     * 已写入磁盘
     */
    APPLIED,

    /**
     * 用户同意但写入失败
     */
    FAILED,

    SKIPPED
}
