package io.leavesfly.meer.engine.approval;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 非交互审批：YOLO 模式全部应用，dry-run 模式全部跳过
 */
@Slf4j
public class AutoEditApprover implements EditApprover {

    private final EditDecision decision;

    private AutoEditApprover(EditDecision decision) {
        this.decision = decision;
    }

    public static AutoEditApprover applyAll() {
        return new AutoEditApprover(EditDecision.APPLY_ALL);
    }

    public static AutoEditApprover skipAll() {
        return new AutoEditApprover(EditDecision.SKIP_ALL);
    }

    @Override
    public EditDecision decide(ProposedEdit edit, List<String> diffLines, int index, int total) {
        log.debug("Auto decision {} for {}", decision, edit.getPath());
        return decision;
    }
}
