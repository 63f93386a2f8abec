package io.leavesfly.meer.agent;

import io.leavesfly.meer.exception.AgentDefinitionException;
import io.leavesfly.meer.exception.AgentNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Agent 注册表
 * 集中管理三个层级（project / user / builtin）中的 Agent 定义
 * <p>
 * 职责：
 * - 扫描各层级目录下的 *.md 文件并解析
 * - 同名定义按层级优先级去重，先出现者胜出
 * - 提供查询、搜索、保存、删除
 * <p>
 * 重新加载时构建新映射后整体替换，读操作不会看到加载到一半的状态。
 */
@Slf4j
public class AgentRegistry {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]*$");
    private static final String FILE_SUFFIX = ".md";

    private final AgentStoreLocations locations;

    private volatile Map<String, AgentDiscoveryResult> agents = Collections.emptyMap();

    public AgentRegistry(AgentStoreLocations locations) {
        this.locations = locations;
    }

    /**
     * 重新扫描所有层级；单个文件解析失败只记录警告
     */
    public synchronized void loadAgents() {
        Map<String, AgentDiscoveryResult> loaded = new LinkedHashMap<>();
        for (AgentScope scope : AgentScope.values()) {
            Path dir = locations.dirFor(scope);
            if (dir == null || !Files.isDirectory(dir)) {
                continue;
            }
            for (Path file : listDefinitionFiles(dir)) {
                AgentDiscoveryResult result = loadFile(file, scope);
                if (result == null) {
                    continue;
                }
                String name = result.getDefinition().getName();
                if (loaded.containsKey(name)) {
                    log.debug("Agent {} in {} scope shadowed by {}", name, scope, loaded.get(name).getScope());
                    continue;
                }
                loaded.put(name, result);
            }
        }
        this.agents = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} agent definition(s)", loaded.size());
    }

    public Optional<AgentDefinition> getAgent(String name) {
        return getAgentResult(name).map(AgentDiscoveryResult::getDefinition);
    }

    public Optional<AgentDiscoveryResult> getAgentResult(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public boolean hasAgent(String name) {
        return agents.containsKey(name);
    }

    public List<AgentDiscoveryResult> getAllAgents() {
        return new ArrayList<>(agents.values());
    }

    public List<AgentDiscoveryResult> getEnabledAgents() {
        return agents.values().stream()
                .filter(result -> result.getDefinition().isEnabled())
                .collect(Collectors.toList());
    }

    /**
     * 按名称、描述和标签做大小写不敏感的子串匹配
     */
    public List<AgentDiscoveryResult> searchAgents(String query) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return agents.values().stream()
                .filter(result -> matches(result.getDefinition(), needle))
                .collect(Collectors.toList());
    }

    /**
     * 写入定义文件并重新加载
     *
     * @return 写入的文件路径
     * @throws IllegalArgumentException 名称非法或目标为 builtin 层级
     */
    public synchronized Path saveAgent(AgentDefinition definition, AgentScope scope) {
        String name = definition.getName();
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid agent name: " + name
                    + " (use lowercase letters, digits and hyphens, starting with a letter or digit)");
        }
        if (!scope.isWritable()) {
            throw new IllegalArgumentException("Cannot save agents to the builtin scope");
        }
        if (definition.getDescription() == null || definition.getDescription().isBlank()) {
            throw new IllegalArgumentException("Agent description must not be empty");
        }

        Path dir = locations.dirFor(scope);
        Path file = dir.resolve(name + FILE_SUFFIX);
        try {
            Files.createDirectories(dir);
            Files.writeString(file, AgentDefinitionLoader.serialize(definition), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AgentDefinitionException("Failed to write agent file: " + file, e);
        }
        log.info("Saved agent {} to {}", name, file);
        loadAgents();
        return file;
    }

    /**
     * 删除定义文件并重新加载
     *
     * @throws AgentNotFoundException 该层级下不存在对应文件
     */
    public synchronized void deleteAgent(String name, AgentScope scope) {
        if (!scope.isWritable()) {
            throw new IllegalArgumentException("Cannot delete agents from the builtin scope");
        }
        Path dir = locations.dirFor(scope);
        Path file = dir.resolve(name + FILE_SUFFIX);
        if (!Files.isRegularFile(file)) {
            throw new AgentNotFoundException("Agent not found: " + name + " in " + scope + " scope");
        }
        try {
            Files.delete(file);
        } catch (IOException e) {
            throw new AgentDefinitionException("Failed to delete agent file: " + file, e);
        }
        log.info("Deleted agent {} from {}", name, file);
        loadAgents();
    }

    /**
     * 修改启用状态，写回定义所在的层级
     *
     * @throws AgentNotFoundException 名称未注册
     */
    public synchronized Path setEnabled(String name, boolean enabled) {
        AgentDiscoveryResult result = getAgentResult(name)
                .orElseThrow(() -> new AgentNotFoundException("Agent not found: " + name));
        AgentScope target = result.getScope().isWritable() ? result.getScope() : AgentScope.USER;
        return saveAgent(result.getDefinition().toBuilder().enabled(enabled).build(), target);
    }

    public AgentStoreLocations getLocations() {
        return locations;
    }

    private static boolean matches(AgentDefinition definition, String needle) {
        if (needle.isEmpty()) {
            return true;
        }
        if (contains(definition.getName(), needle) || contains(definition.getDescription(), needle)) {
            return true;
        }
        return definition.getTags() != null
                && definition.getTags().stream().anyMatch(tag -> contains(tag, needle));
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private List<Path> listDefinitionFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list agent directory {}: {}", dir, e.getMessage());
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }

    private AgentDiscoveryResult loadFile(Path file, AgentScope scope) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            AgentDefinition definition = AgentDefinitionLoader.parse(content);
            Instant lastModified = Files.getLastModifiedTime(file).toInstant();
            return new AgentDiscoveryResult(definition, file, scope, lastModified);
        } catch (IOException | AgentDefinitionException e) {
            log.warn("Skipping agent file {}: {}", file, e.getMessage());
            return null;
        }
    }
}
