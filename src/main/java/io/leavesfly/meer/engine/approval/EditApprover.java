package io.leavesfly.meer.engine.approval;

import java.util.List;

/**
 * 人工审批接口
 * 展示一个编辑及其 diff，返回四种决定之一
 */
public interface EditApprover {

    /**
     * @param edit      待审核的编辑
     * @param diffLines 与磁盘内容的行级 diff，新文件时为内容预览
     * @param index     当前编辑序号（从 1 开始）
     * @param total     编辑总数
     */
    EditDecision decide(ProposedEdit edit, List<String> diffLines, int index, int total);
}
