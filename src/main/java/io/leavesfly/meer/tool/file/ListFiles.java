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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * list_files 工具 - 列出目录内容
 * 目录在前（以 / 结尾），文件在后并附带大小
 */
@Slf4j
public class ListFiles extends AbstractTool<ListFiles.Params> {

    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty("path")
        @JsonPropertyDescription("目录路径，相对于工作目录，默认为工作目录本身")
        @Builder.Default
        private String path = ".";
    }

    public ListFiles(Path workDir) {
        super("list_files", "列出目录中的文件和子目录。", Params.class);
        this.workDir = workDir;
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        return Mono.fromCallable(() -> {
            String requested = params.getPath() == null || params.getPath().isBlank() ? "." : params.getPath();
            Path dir;
            try {
                dir = WorkDirPaths.resolve(workDir, requested);
            } catch (IllegalArgumentException e) {
                return ToolResult.error(e.getMessage());
            }

            if (!Files.exists(dir)) {
                return ToolResult.error(String.format("Directory not found: %s", requested));
            }
            if (!Files.isDirectory(dir)) {
                return ToolResult.error(String.format("`%s` is not a directory. Use read_file for files.", requested));
            }

            List<Path> entries;
            try (Stream<Path> stream = Files.list(dir)) {
                entries = stream.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .collect(Collectors.toList());
            } catch (IOException e) {
                log.error("Failed to list directory: {}", requested, e);
                return ToolResult.error(String.format("Failed to list %s. Error: %s", requested, e.getMessage()));
            }

            List<String> dirs = new ArrayList<>();
            List<String> files = new ArrayList<>();
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry)) {
                    dirs.add(name + "/");
                } else {
                    files.add(String.format("%s (%s)", name, formatSize(sizeOf(entry))));
                }
            }

            StringBuilder output = new StringBuilder("Directory: ").append(requested).append("\n\n");
            if (dirs.isEmpty() && files.isEmpty()) {
                output.append("(empty)");
            } else {
                dirs.forEach(d -> output.append(d).append('\n'));
                files.forEach(f -> output.append(f).append('\n'));
            }
            return ToolResult.ok(output.toString().trim(),
                    String.format("%d directories, %d files", dirs.size(), files.size()));
        });
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot read size of {}", file, e);
            return -1;
        }
    }

    static String formatSize(long bytes) {
        if (bytes < 0) {
            return "?";
        }
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format("%.1f KB", bytes / 1024.0);
        }
        return String.format("%.1f MB", bytes / (1024.0 * 1024));
    }
}
