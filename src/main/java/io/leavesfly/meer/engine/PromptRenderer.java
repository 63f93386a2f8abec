package io.leavesfly.meer.engine;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringSubstitutor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 系统提示词渲染
 * <p>
 * 模板位于 classpath:prompts/，占位符使用 ${NAME} 语法。
 */
@Slf4j
public final class PromptRenderer {

    static final String SYSTEM_TEMPLATE = "prompts/system.md";
    static final String TOOL_PROTOCOL_TEMPLATE = "prompts/tool_protocol.md";

    private PromptRenderer() {
    }

    /**
     * 渲染主代理的系统提示词
     *
     * @param workDir  工作目录
     * @param registry 主代理的工具注册表
     * @param agents   可委托的子代理
     */
    public static String renderMainPrompt(Path workDir, ToolRegistry registry, List<AgentDefinition> agents) {
        Map<String, String> args = new HashMap<>();
        args.put("MEER_NOW", ZonedDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        args.put("MEER_WORK_DIR", workDir.toAbsolutePath().toString());
        args.put("MEER_WORK_DIR_LS", listWorkDir(workDir));
        args.put("MEER_AGENTS", describeAgents(agents));
        args.put("MEER_TOOLS", renderToolSection(registry));
        return render(SYSTEM_TEMPLATE, args);
    }

    /**
     * 渲染工具调用语法说明和工具清单，子代理的提示词也使用这一段
     */
    public static String renderToolSection(ToolRegistry registry) {
        Map<String, String> args = new HashMap<>();
        args.put("MEER_TOOLS", registry.describeTools());
        return render(TOOL_PROTOCOL_TEMPLATE, args);
    }

    static String describeAgents(List<AgentDefinition> agents) {
        if (agents == null || agents.isEmpty()) {
            return "(no sub-agents available)";
        }
        return agents.stream()
                .map(agent -> "- " + agent.getName() + ": " + agent.getDescription())
                .collect(Collectors.joining("\n"));
    }

    /**
     * 列出工作目录的第一层内容
     */
    static String listWorkDir(Path workDir) {
        try (Stream<Path> entries = Files.list(workDir)) {
            return entries
                    .sorted()
                    .map(p -> (Files.isDirectory(p) ? "dir  " : "file ") + p.getFileName())
                    .collect(Collectors.joining("\n"));
        } catch (IOException e) {
            log.warn("Failed to list work dir: {}", workDir, e);
            return "(unavailable)";
        }
    }

    private static String render(String templatePath, Map<String, String> args) {
        String template = loadTemplate(templatePath);
        return new StringSubstitutor(args).replace(template).strip();
    }

    private static String loadTemplate(String templatePath) {
        try (InputStream in = PromptRenderer.class.getClassLoader().getResourceAsStream(templatePath)) {
            if (in == null) {
                throw new MeerException("Prompt template not found on classpath: " + templatePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MeerException("Failed to read prompt template: " + templatePath, e);
        }
    }
}
