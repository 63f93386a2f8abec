package io.leavesfly.meer.tool.file;

import io.leavesfly.meer.engine.approval.EditApplier;
import io.leavesfly.meer.engine.approval.ProposedEdit;
import io.leavesfly.meer.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 编辑落盘：在工作目录内写文件，必要时创建父目录
 */
@Slf4j
public class FileEditApplier implements EditApplier {

    private final Path workDir;

    public FileEditApplier(Path workDir) {
        this.workDir = workDir;
    }

    @Override
    public ToolResult apply(ProposedEdit edit) {
        try {
            Path target = WorkDirPaths.resolve(workDir, edit.getPath());
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, edit.getNewContent(), StandardCharsets.UTF_8);
            log.info("Applied edit to {}", target);
            return ToolResult.ok("", String.format("Successfully updated %s", edit.getPath()));
        } catch (Exception e) {
            log.error("Failed to write {}", edit.getPath(), e);
            return ToolResult.error(String.format("Failed to write %s. Error: %s", edit.getPath(), e.getMessage()));
        }
    }
}
