package io.leavesfly.meer.tool.file;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import io.leavesfly.meer.engine.approval.ProposedEdit;
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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * propose_edit 工具 - 提议文件修改
 * <p>
 * 不写盘：读取当前内容，校验新内容后生成 ProposedEdit，
 * 由循环结束后的审核会话决定是否落盘。
 */
@Slf4j
public class ProposeEdit extends AbstractTool<ProposeEdit.Params> {

    /**
     * 模型偷懒省略内容时常见的占位写法
     */
    private static final List<Pattern> PLACEHOLDER_PATTERNS = List.of(
            Pattern.compile("rest of (the )?file", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rest of (the )?code", Pattern.CASE_INSENSITIVE),
            Pattern.compile("rest will remain( the same)?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("remaining (code|file|content)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.\\.\\s*(rest|snip|omitted)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bTODO:?[^.\\n]*rest", Pattern.CASE_INSENSITIVE)
    );

    private final Path workDir;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "path", required = true)
        @JsonPropertyDescription("要创建或修改的文件路径，相对于工作目录")
        private String path;

        @JsonProperty("description")
        @JsonPropertyDescription("对修改内容的简短说明")
        private String description;
    }

    public ProposeEdit(Path workDir) {
        super("propose_edit",
                "提议创建或整体替换一个文件。修改不会立即写入，结束后由用户逐个审核。",
                Params.class);
        this.workDir = workDir;
    }

    @Override
    public String getBodyDescription() {
        return "文件的完整新内容，不能省略任何部分";
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
            if (Files.isDirectory(path)) {
                return ToolResult.error(String.format("`%s` is a directory.", params.getPath()));
            }

            String oldContent = "";
            if (Files.exists(path)) {
                try {
                    oldContent = Files.readString(path, StandardCharsets.UTF_8);
                } catch (Exception e) {
                    log.error("Failed to read current content of {}", params.getPath(), e);
                    return ToolResult.error(String.format("Failed to read %s. Error: %s",
                            params.getPath(), e.getMessage()));
                }
            }

            String newContent = body != null ? body : "";
            if (newContent.trim().isEmpty() && !oldContent.trim().isEmpty()) {
                return ToolResult.error(String.format("Refusing to replace %s with empty content. "
                        + "Provide the complete new file content.", params.getPath()));
            }

            String placeholder = findPlaceholder(newContent);
            if (placeholder != null) {
                return ToolResult.error(String.format("The proposed content for %s contains placeholder text "
                        + "(\"%s\"). Provide the complete file content without omissions.",
                        params.getPath(), placeholder));
            }

            ProposedEdit edit = ProposedEdit.builder()
                    .path(params.getPath().trim())
                    .description(params.getDescription() != null ? params.getDescription() : "")
                    .oldContent(oldContent)
                    .newContent(newContent)
                    .build();
            String message = oldContent.isEmpty()
                    ? String.format("Proposed new file %s; it will be reviewed after you finish.", params.getPath())
                    : String.format("Proposed changes to %s; they will be reviewed after you finish.",
                    params.getPath());
            return ToolResult.proposed(edit, message);
        });
    }

    static String findPlaceholder(String content) {
        for (Pattern pattern : PLACEHOLDER_PATTERNS) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                return matcher.group();
            }
        }
        return null;
    }
}
