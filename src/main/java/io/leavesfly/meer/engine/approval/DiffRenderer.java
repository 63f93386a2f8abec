package io.leavesfly.meer.engine.approval;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 生成编辑的行级 diff
 */
public class DiffRenderer {

    private static final int CONTEXT_LINES = 3;

    private final int newFilePreviewLines;
    private final int maxDiffLines;

    public DiffRenderer(int newFilePreviewLines, int maxDiffLines) {
        this.newFilePreviewLines = newFilePreviewLines;
        this.maxDiffLines = maxDiffLines;
    }

    public DiffRenderer() {
        this(20, 200);
    }

    /**
     * 新文件返回内容预览，已有文件返回 unified diff
     */
    public List<String> render(ProposedEdit edit) {
        List<String> newLines = splitLines(edit.getNewContent());
        if (edit.isNewFile()) {
            return preview(newLines);
        }

        List<String> oldLines = splitLines(edit.getOldContent());
        Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return List.of("(no changes)");
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + edit.getPath(), "b/" + edit.getPath(), oldLines, patch, CONTEXT_LINES);
        return truncate(unified);
    }

    private List<String> preview(List<String> lines) {
        List<String> result = new ArrayList<>();
        result.add(String.format("new file (%d lines)", lines.size()));
        int shown = Math.min(newFilePreviewLines, lines.size());
        for (int i = 0; i < shown; i++) {
            result.add("+" + lines.get(i));
        }
        if (lines.size() > shown) {
            result.add(String.format("... %d more lines", lines.size() - shown));
        }
        return result;
    }

    private List<String> truncate(List<String> lines) {
        if (lines.size() <= maxDiffLines) {
            return lines;
        }
        List<String> result = new ArrayList<>(lines.subList(0, maxDiffLines));
        result.add(String.format("... %d more diff lines", lines.size() - maxDiffLines));
        return result;
    }

    private static List<String> splitLines(String content) {
        if (content == null || content.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(content.split("\r?\n", -1)));
    }
}
