package io.leavesfly.meer.engine.approval;

import io.leavesfly.meer.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * 编辑审核会话
 * <p>
 * 在 Agent 循环结束后运行一次：按收集顺序逐个展示编辑并征求决定，
 * APPLY_ALL / SKIP_ALL 之后不再询问。每个编辑都会在摘要中留下一条记录。
 * <p>
 * 取消令牌在每次询问和每次写盘之前检查，触发后剩余编辑一律记为 SKIPPED。
 */
@Slf4j
public class EditReviewSession {

    private final EditApprover approver;
    private final EditApplier applier;
    private final DiffRenderer diffRenderer;
    private final BooleanSupplier cancellation;

    public EditReviewSession(EditApprover approver, EditApplier applier, DiffRenderer diffRenderer) {
        this(approver, applier, diffRenderer, null);
    }

    public EditReviewSession(EditApprover approver, EditApplier applier, DiffRenderer diffRenderer,
                             BooleanSupplier cancellation) {
        this.approver = approver;
        this.applier = applier;
        this.diffRenderer = diffRenderer;
        this.cancellation = cancellation != null ? cancellation : () -> false;
    }

    /**
     * 审核全部编辑
     *
     * @return 与输入一一对应的处置记录
     */
    public List<EditReviewEntry> review(List<ProposedEdit> edits) {
        if (edits == null || edits.isEmpty()) {
            return Collections.emptyList();
        }

        List<EditReviewEntry> summary = new ArrayList<>(edits.size());
        EditDecision bulkDecision = null;

        for (int i = 0; i < edits.size(); i++) {
            ProposedEdit edit = edits.get(i);
            if (cancellation.getAsBoolean()) {
                log.warn("Edit review cancelled, skipping {} remaining edit(s)", edits.size() - i);
                summary.addAll(skipAll(edits.subList(i, edits.size())));
                break;
            }

            EditDecision decision;
            if (bulkDecision != null) {
                decision = bulkDecision;
            } else {
                decision = askApprover(edit, i + 1, edits.size());
                if (decision.isBulk()) {
                    bulkDecision = decision;
                }
            }

            boolean apply = decision.isApply() && !cancellation.getAsBoolean();
            summary.add(apply ? apply(edit) : skip(edit));
        }

        log.info("Edit review finished: {} applied, {} failed, {} skipped",
                count(summary, EditDisposition.APPLIED),
                count(summary, EditDisposition.FAILED),
                count(summary, EditDisposition.SKIPPED));
        return summary;
    }

    private EditDecision askApprover(ProposedEdit edit, int index, int total) {
        try {
            EditDecision decision = approver.decide(edit, diffRenderer.render(edit), index, total);
            return decision != null ? decision : EditDecision.SKIP;
        } catch (RuntimeException e) {
            // 审批端异常时不写盘
            log.error("Approver failed for {}, skipping edit", edit.getPath(), e);
            return EditDecision.SKIP;
        }
    }

    /**
     * 不询问、不写盘，全部记为 SKIPPED
     */
    public List<EditReviewEntry> skipAll(List<ProposedEdit> edits) {
        List<EditReviewEntry> summary = new ArrayList<>(edits.size());
        for (ProposedEdit edit : edits) {
            summary.add(skip(edit));
        }
        return summary;
    }

    private EditReviewEntry apply(ProposedEdit edit) {
        ToolResult result;
        try {
            result = applier.apply(edit);
        } catch (RuntimeException e) {
            log.error("Failed to apply edit to {}", edit.getPath(), e);
            result = ToolResult.error(e.getMessage());
        }

        if (result.isError()) {
            edit.setDisposition(EditDisposition.FAILED);
            return new EditReviewEntry(edit.getPath(), EditDisposition.FAILED, result.getMessage());
        }
        edit.setDisposition(EditDisposition.APPLIED);
        return new EditReviewEntry(edit.getPath(), EditDisposition.APPLIED, result.toObservationText());
    }

    private EditReviewEntry skip(ProposedEdit edit) {
        edit.setDisposition(EditDisposition.SKIPPED);
        return new EditReviewEntry(edit.getPath(), EditDisposition.SKIPPED, "");
    }

    private static long count(List<EditReviewEntry> entries, EditDisposition disposition) {
        return entries.stream().filter(e -> e.getDisposition() == disposition).count();
    }
}
