package io.leavesfly.meer.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工具白名单过滤器
 * <p>
 * 职责：
 * - 白名单为空或未设置时不做限制
 * - 以 '*' 结尾的条目按前缀匹配
 * - 为被拒绝的调用生成错误说明
 */
@Slf4j
public class ToolFilter {

    /**
     * 内置工具分组
     */
    public enum Category {
        READ_ONLY(List.of("read_file", "list_files", "find_files", "search_text")),
        WRITE(List.of("propose_edit")),
        EXECUTE(List.of("run_command"));

        private final List<String> tools;

        Category(List<String> tools) {
            this.tools = tools;
        }

        public List<String> getTools() {
            return tools;
        }
    }

    private static final String WILDCARD = "*";

    private final String agentName;
    private final Set<String> allowedTools;

    public ToolFilter(String agentName, Collection<String> allowedTools) {
        this.agentName = agentName;
        this.allowedTools = allowedTools == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedTools));
    }

    /**
     * 不做任何限制的过滤器
     */
    public static ToolFilter unrestricted(String agentName) {
        return new ToolFilter(agentName, null);
    }

    public boolean isRestricted() {
        return !allowedTools.isEmpty();
    }

    public boolean isAllowed(String toolName) {
        if (!isRestricted()) {
            return true;
        }
        for (String pattern : allowedTools) {
            if (pattern.endsWith(WILDCARD)) {
                String prefix = pattern.substring(0, pattern.length() - WILDCARD.length());
                if (toolName.startsWith(prefix)) {
                    return true;
                }
            } else if (pattern.equals(toolName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 过滤工具名列表，保持原顺序
     */
    public List<String> filter(Collection<String> toolNames) {
        return toolNames.stream().filter(this::isAllowed).collect(Collectors.toList());
    }

    /**
     * 校验工具调用
     *
     * @return 不允许时返回错误说明
     */
    public Optional<String> validate(String toolName) {
        if (isAllowed(toolName)) {
            return Optional.empty();
        }
        log.warn("Agent '{}' attempted to use disallowed tool '{}'", agentName, toolName);
        return Optional.of(String.format("Tool \"%s\" is not allowed for agent \"%s\". Allowed tools: %s",
                toolName, agentName, String.join(", ", allowedTools)));
    }

    public Set<String> getAllowedTools() {
        return allowedTools;
    }

    public String getAgentName() {
        return agentName;
    }
}
