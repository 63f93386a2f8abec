package io.leavesfly.meer.engine.approval;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 审核摘要中的一条记录
 */
@Getter
@AllArgsConstructor
public class EditReviewEntry {

    private final String path;

    private final EditDisposition disposition;

    /**
     * 写入结果或失败原因
     */
    private final String message;

    @Override
    public String toString() {
        return String.format("%s %s%s", disposition, path, message == null || message.isEmpty() ? "" : ": " + message);
    }
}
