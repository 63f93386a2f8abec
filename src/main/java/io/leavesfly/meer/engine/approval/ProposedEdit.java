package io.leavesfly.meer.engine.approval;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工具提议的文件修改
 * <p>
 * 在一次循环运行中收集，只由 EditReviewSession 标记处置结果，运行结束后丢弃
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedEdit {

    /**
     * 相对工作目录的路径
     */
    private String path;

    private String description;

    /**
     * 修改前的内容，新文件为空串
     */
    @Builder.Default
    private String oldContent = "";

    private String newContent;

    /**
     * 审核后的处置结果，未审核时为 null
     */
    private EditDisposition disposition;

    public boolean isNewFile() {
        return oldContent == null || oldContent.isEmpty();
    }
}
