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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * search_text 工具 - 使用正则表达式搜索文件内容
 * 跳过隐藏目录、构建产物目录、大文件和二进制文件
 */
@Slf4j
public class Grep extends AbstractTool<Grep.Params> {

    private static final int MAX_MATCHES = 200;
    private static final int MAX_FILE_SIZE = 2 * 1024 * 1024;
    private static final int BINARY_CHECK_SIZE = 8192;
    private static final int MAX_LINE_LENGTH = 300;
    private static final Set<String> SKIPPED_DIRS = Set.of("node_modules", "target", "build", "dist", "out");

    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "pattern", required = true)
        @JsonPropertyDescription("Java 正则表达式")
        private String pattern;

        @JsonProperty("path")
        @JsonPropertyDescription("搜索的文件或目录，相对于工作目录，默认 '.'")
        @Builder.Default
        private String path = ".";

        @JsonProperty("include")
        @JsonPropertyDescription("文件名 glob 过滤，例如 *.java")
        private String include;

        @JsonProperty("ignore_case")
        @JsonPropertyDescription("是否忽略大小写，默认 false")
        @Builder.Default
        private boolean ignoreCase = false;
    }

    public Grep(Path workDir) {
        super("search_text",
                String.format("在文件内容中搜索正则表达式，返回 路径:行号:内容，最多 %d 条。", MAX_MATCHES),
                Params.class);
        this.workDir = workDir;
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        return Mono.fromCallable(() -> {
            if (params.getPattern() == null || params.getPattern().isEmpty()) {
                return ToolResult.error("Pattern is required. Please provide a valid regex pattern.");
            }

            Pattern pattern;
            try {
                pattern = Pattern.compile(params.getPattern(), params.isIgnoreCase() ? Pattern.CASE_INSENSITIVE : 0);
            } catch (PatternSyntaxException e) {
                return ToolResult.error(String.format("Invalid regex pattern: %s", e.getMessage()));
            }

            Path searchPath;
            try {
                searchPath = WorkDirPaths.resolve(workDir, params.getPath() == null ? "." : params.getPath());
            } catch (IllegalArgumentException e) {
                return ToolResult.error(e.getMessage());
            }
            if (!Files.exists(searchPath)) {
                return ToolResult.error(String.format("Path does not exist: %s", params.getPath()));
            }

            PathMatcher include = params.getInclude() == null || params.getInclude().isBlank()
                    ? null
                    : searchPath.getFileSystem().getPathMatcher("glob:" + params.getInclude());

            List<String> matches = new ArrayList<>();
            try {
                if (Files.isRegularFile(searchPath)) {
                    searchFile(searchPath, pattern, matches);
                } else {
                    walk(searchPath, pattern, include, matches);
                }
            } catch (IOException | UncheckedIOException e) {
                log.error("Failed to search {} in {}", params.getPattern(), params.getPath(), e);
                return ToolResult.error(String.format("Failed to search. Error: %s", e.getMessage()));
            }

            if (matches.isEmpty()) {
                return ToolResult.ok("", String.format("No matches found for `%s`.", params.getPattern()));
            }
            String message = String.format("Found %d matching lines.", Math.min(matches.size(), MAX_MATCHES));
            if (matches.size() > MAX_MATCHES) {
                matches = matches.subList(0, MAX_MATCHES);
                message += String.format(" Only the first %d are shown; narrow the search.", MAX_MATCHES);
            }
            return ToolResult.ok(String.join("\n", matches), message);
        });
    }

    private void walk(Path root, Pattern pattern, PathMatcher include, List<String> matches) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || SKIPPED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (matches.size() > MAX_MATCHES) {
                    return FileVisitResult.TERMINATE;
                }
                if (attrs.size() > MAX_FILE_SIZE || file.getFileName().toString().startsWith(".")) {
                    return FileVisitResult.CONTINUE;
                }
                if (include != null && !include.matches(file.getFileName())) {
                    return FileVisitResult.CONTINUE;
                }
                searchFile(file, pattern, matches);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Cannot visit {}", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void searchFile(Path file, Pattern pattern, List<String> matches) throws IOException {
        if (isBinary(file)) {
            return;
        }
        String display = WorkDirPaths.display(workDir, file);
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (pattern.matcher(line).find()) {
                    String text = line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) + "..." : line;
                    matches.add(display + ":" + lineNumber + ":" + text);
                    if (matches.size() > MAX_MATCHES) {
                        return;
                    }
                }
            }
        } catch (CharacterCodingException e) {
            log.debug("Skipped non UTF-8 file: {}", file);
        }
    }

    /**
     * 前 8KB 含 NUL 字节即视为二进制文件
     */
    private static boolean isBinary(Path file) throws IOException {
        byte[] bytes = new byte[BINARY_CHECK_SIZE];
        int read;
        try (InputStream in = Files.newInputStream(file)) {
            read = in.read(bytes);
        }
        for (int i = 0; i < read; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
