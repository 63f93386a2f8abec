package io.leavesfly.meer.tool.bash;

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

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * run_command 工具 - 在工作目录中执行 shell 命令
 * 支持超时控制，stdout 和 stderr 合并输出
 */
@Slf4j
public class Bash extends AbstractTool<Bash.Params> {

    private static final int MAX_TIMEOUT = 5 * 60;
    private static final int MAX_OUTPUT_CHARS = 30_000;

    private final Path workDir;
    private final CommandConfirmation confirmation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Params {

        @JsonProperty(value = "command", required = true)
        @JsonPropertyDescription("需要执行的 shell 命令")
        private String command;

        @JsonProperty("timeout")
        @JsonPropertyDescription("超时时间（秒），取值范围 1-" + MAX_TIMEOUT + "，默认 60")
        @Builder.Default
        private int timeout = 60;
    }

    public Bash(Path workDir, CommandConfirmation confirmation) {
        super("run_command",
                "在工作目录中执行 shell 命令并返回输出。最大超时时间为 " + MAX_TIMEOUT + " 秒。",
                Params.class);
        this.workDir = workDir;
        this.confirmation = confirmation;
    }

    @Override
    public Mono<ToolResult> execute(Params params, String body) {
        return Mono.fromCallable(() -> {
            if (params.getCommand() == null || params.getCommand().trim().isEmpty()) {
                return ToolResult.error("Command is required. Please provide a valid command to execute.");
            }
            if (params.getTimeout() < 1 || params.getTimeout() > MAX_TIMEOUT) {
                return ToolResult.error(String.format(
                        "Invalid timeout: %d. Timeout must be between 1 and %d seconds.",
                        params.getTimeout(), MAX_TIMEOUT));
            }
            if (!confirmation.confirm(params.getCommand())) {
                return ToolResult.error(String.format("Command rejected by user: %s", params.getCommand()));
            }
            return runCommand(params.getCommand(), params.getTimeout());
        });
    }

    private ToolResult runCommand(String command, int timeoutSeconds) {
        String[] cmdArray = System.getProperty("os.name").toLowerCase().contains("win")
                ? new String[]{"cmd.exe", "/c", command}
                : new String[]{"/bin/bash", "-c", command};

        Process process = null;
        try {
            process = new ProcessBuilder(cmdArray)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            InputStream stdout = process.getInputStream();
            CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(stdout));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return ToolResult.error(output.getNow(""),
                        String.format("Command killed by timeout (%ds)", timeoutSeconds));
            }

            String text = truncate(output.get(5, TimeUnit.SECONDS));
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return ToolResult.ok(text, "Command executed successfully.");
            }
            return ToolResult.error(text, String.format("Command failed with exit code: %d.", exitCode));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.error("Command execution was interrupted");
        } catch (Exception e) {
            log.error("Failed to execute command: {}", command, e);
            return ToolResult.error(String.format("Failed to execute command. Error: %s", e.getMessage()));
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.debug("Command output stream closed", e);
            return "";
        }
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_OUTPUT_CHARS) {
            return text;
        }
        return text.substring(0, MAX_OUTPUT_CHARS) + "\n... (output truncated)";
    }
}
