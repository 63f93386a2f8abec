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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * find_files 工具 - 使用 Glob 模式查找文件
 */
@Slf4j
public class Glob extends AbstractTool<Glob.Params> {

    private static final int MAX_MATCHES = 1000;

    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "pattern", required = true)
        @JsonPropertyDescription("相对于搜索目录的 glob 模式，例如 src/**/*.java；不允许以 ** 开头")
        private String pattern;

        @JsonProperty("directory")
        @JsonPropertyDescription("搜索目录，相对于工作目录，默认为工作目录")
        @Builder.Default
        private String directory = ".";
    }

    public Glob(Path workDir) {
        super("find_files",
                String.format("使用 glob 模式查找文件，最多返回 %d 个匹配项。", MAX_MATCHES),
                Params.class);
        this.workDir = workDir;
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        return Mono.fromCallable(() -> {
            if (params.getPattern() == null || params.getPattern().trim().isEmpty()) {
                return ToolResult.error("Pattern is required. Please provide a valid glob pattern.");
            }
            if (params.getPattern().startsWith("**")) {
                return ToolResult.error(String.format("Pattern `%s` starts with '**' which is not allowed. "
                        + "It would scan every directory including large ones like node_modules. "
                        + "Use a more specific pattern such as src/**/*.java.", params.getPattern()));
            }

            Path searchDir;
            try {
                searchDir = WorkDirPaths.resolve(workDir,
                        params.getDirectory() == null ? "." : params.getDirectory());
            } catch (IllegalArgumentException e) {
                return ToolResult.error(e.getMessage());
            }
            if (!Files.isDirectory(searchDir)) {
                return ToolResult.error(String.format("`%s` is not a directory.", params.getDirectory()));
            }

            PathMatcher matcher = searchDir.getFileSystem().getPathMatcher("glob:" + params.getPattern());
            List<Path> matches;
            try (Stream<Path> stream = Files.walk(searchDir)) {
                matches = stream.filter(Files::isRegularFile)
                        .filter(p -> matcher.matches(searchDir.relativize(p)))
                        .sorted()
                        .limit(MAX_MATCHES + 1L)
                        .collect(Collectors.toList());
            } catch (Exception e) {
                log.error("Failed to execute glob: {}", params.getPattern(), e);
                return ToolResult.error(String.format("Failed to search for pattern %s. Error: %s",
                        params.getPattern(), e.getMessage()));
            }

            if (matches.isEmpty()) {
                return ToolResult.ok("", String.format("No matches found for pattern `%s`.", params.getPattern()));
            }
            String message = String.format("Found %d matches for pattern `%s`.",
                    Math.min(matches.size(), MAX_MATCHES), params.getPattern());
            if (matches.size() > MAX_MATCHES) {
                matches = matches.subList(0, MAX_MATCHES);
                message += String.format(" Only the first %d matches are returned.", MAX_MATCHES);
            }
            String output = matches.stream()
                    .map(p -> WorkDirPaths.display(workDir, p))
                    .collect(Collectors.joining("\n"));
            return ToolResult.ok(output, message);
        });
    }
}
