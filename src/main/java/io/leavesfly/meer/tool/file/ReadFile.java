package io.leavesfly.meer.tool.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import io.leavesfly.meer.tool.AbstractTool;
import io.leavesfly.meer.tool.ToolResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * read_file 工具 - 读取文件全文
 * <p>
 * 文件不存在不算错误：返回提示，引导模型用 propose_edit 创建文件
 */
@Slf4j
public class ReadFile extends AbstractTool<ReadFile.Params> {

    private static final int MAX_BYTES = 256 * 1024;

    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "path", required = true)
        @JsonPropertyDescription("文件路径，相对于工作目录")
        private String path;
    }

    public ReadFile(Path workDir) {
        super("read_file", "读取文件的完整内容。", Params.class);
        this.workDir = workDir;
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        return Mono.fromCallable(() -> {
            Path path;
            try {
                path = WorkDirPaths.resolve(workDir, params.getPath());
            } catch (IllegalArgumentException e) {
                return ToolResult.error(e.getMessage());
            }

            if (!Files.exists(path)) {
                return ToolResult.ok(String.format("File not found: %s. The file does not exist yet; "
                        + "use propose_edit to create it.", params.getPath()), "File not found");
            }
            if (!Files.isRegularFile(path)) {
                return ToolResult.error(String.format("`%s` is not a file. Use list_files for directories.",
                        params.getPath()));
            }

            try {
                long size = Files.size(path);
                if (size > MAX_BYTES) {
                    return ToolResult.error(String.format("`%s` is too large (%d bytes, limit %d bytes).",
                            params.getPath(), size, MAX_BYTES));
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                int lines = content.isEmpty() ? 0 : content.split("\r?\n", -1).length;
                return ToolResult.ok(String.format("File: %s (%d lines)\n\n%s", params.getPath(), lines, content),
                        String.format("Read %d lines", lines));
            } catch (Exception e) {
                log.error("Failed to read file: {}", params.getPath(), e);
                return ToolResult.error(String.format("Failed to read %s. Error: %s",
                        params.getPath(), e.getMessage()));
            }
        });
    }
}
