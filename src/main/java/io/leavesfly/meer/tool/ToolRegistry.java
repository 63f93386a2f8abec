package io.leavesfly.meer.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.meer.engine.toolcall.ToolInvocation;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工具注册表
 * 按名称分发工具调用，并生成写入系统提示词的工具说明
 * <p>
 * 注意：ToolRegistry 不是 Spring Bean，主代理和每个子代理各自持有一份，
 * 工作目录和白名单都绑定在实例上
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, Tool<?>> tools = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;
    private final ToolFilter filter;

    public ToolRegistry(ObjectMapper objectMapper, ToolFilter filter) {
        this.objectMapper = objectMapper;
        this.filter = filter;
    }

    public void register(Tool<?> tool) {
        tools.put(tool.getName(), tool);
        log.debug("Registered tool: {}", tool.getName());
    }

    public Optional<Tool<?>> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * 当前代理可见的工具名（已按白名单过滤）
     */
    public List<String> getToolNames() {
        return filter.filter(tools.keySet());
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name) && filter.isAllowed(name);
    }

    public ToolFilter getFilter() {
        return filter;
    }

    /**
     * 执行工具调用
     * 未知工具、白名单外的工具和参数错误都转换为错误结果，不抛出异常
     */
    public Mono<ToolResult> execute(ToolInvocation invocation) {
        return Mono.defer(() -> {
            String toolName = invocation.getToolName();

            Optional<String> denied = filter.validate(toolName);
            if (denied.isPresent()) {
                return Mono.just(ToolResult.error(denied.get()));
            }

            Tool<?> tool = tools.get(toolName);
            if (tool == null) {
                return Mono.just(ToolResult.error(String.format("Unknown tool: %s. Available tools: %s",
                        toolName, String.join(", ", getToolNames()))));
            }

            Object params;
            try {
                params = objectMapper.convertValue(invocation.getParams(), tool.getParamsType());
            } catch (IllegalArgumentException e) {
                log.warn("Invalid parameters for tool {}: {}", toolName, invocation.getParams(), e);
                return Mono.just(ToolResult.error(String.format("Invalid parameters for tool %s: %s",
                        toolName, e.getMessage())));
            }

            return executeUnchecked(tool, params, invocation.getBody());
        }).onErrorResume(e -> {
            log.error("Tool {} failed", invocation.getToolName(), e);
            return Mono.just(ToolResult.error(String.format("Failed to execute tool %s. Error: %s",
                    invocation.getToolName(), e.getMessage())));
        });
    }

    @SuppressWarnings("unchecked")
    private <P> Mono<ToolResult> executeUnchecked(Tool<?> tool, Object params, String body) {
        Tool<P> typedTool = (Tool<P>) tool;
        return typedTool.execute((P) params, body != null ? body : "");
    }

    /**
     * 生成工具说明，写入系统提示词
     */
    public String describeTools() {
        StringBuilder sb = new StringBuilder();
        for (String name : getToolNames()) {
            Tool<?> tool = tools.get(name);
            sb.append("### ").append(name).append('\n');
            sb.append(tool.getDescription()).append('\n');

            List<String> attributes = describeParams(tool.getParamsType());
            if (!attributes.isEmpty()) {
                sb.append("Attributes:\n");
                attributes.forEach(line -> sb.append("- ").append(line).append('\n'));
            }
            if (tool.getBodyDescription() != null) {
                sb.append("Body: ").append(tool.getBodyDescription()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private List<String> describeParams(Class<?> paramsType) {
        List<String> lines = new ArrayList<>();
        if (paramsType == null) {
            return lines;
        }
        for (Field field : paramsType.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            String propName = field.getName();
            boolean required = false;
            JsonProperty jp = field.getAnnotation(JsonProperty.class);
            if (jp != null) {
                if (!jp.value().isEmpty()) {
                    propName = jp.value();
                }
                required = jp.required();
            }
            JsonPropertyDescription desc = field.getAnnotation(JsonPropertyDescription.class);
            String line = propName + (required ? " (required)" : " (optional)");
            if (desc != null && !desc.value().isEmpty()) {
                line += ": " + desc.value();
            }
            lines.add(line);
        }
        return lines;
    }
}
