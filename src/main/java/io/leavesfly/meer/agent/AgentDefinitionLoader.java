package io.leavesfly.meer.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.leavesfly.meer.exception.AgentDefinitionException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Agent 定义文件的解析与序列化
 * <p>
 * 文件格式：YAML 前置元数据包裹在两行 "---" 之间，其后的正文是系统提示词。
 */
class AgentDefinitionLoader {

    private static final Pattern FRONTMATTER = Pattern.compile("^---\\r?\\n([\\s\\S]*?)\\r?\\n---\\r?\\n?([\\s\\S]*)$");

    private static final ObjectMapper YAML_READER = new ObjectMapper(new YAMLFactory());

    private static final ObjectMapper YAML_WRITER = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .build());

    private AgentDefinitionLoader() {
    }

    /**
     * 解析定义文件内容
     *
     * @throws AgentDefinitionException 缺少前置元数据、YAML 非法或缺少必填字段
     */
    static AgentDefinition parse(String content) {
        String normalized = content.startsWith("\uFEFF") ? content.substring(1) : content;
        Matcher matcher = FRONTMATTER.matcher(normalized);
        if (!matcher.matches()) {
            throw new AgentDefinitionException("Invalid agent file format: missing YAML frontmatter");
        }

        Map<String, Object> meta;
        try {
            meta = YAML_READER.readValue(matcher.group(1), new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new AgentDefinitionException("Invalid YAML frontmatter: " + e.getOriginalMessage(), e);
        }
        if (meta == null) {
            throw new AgentDefinitionException("Invalid agent file format: empty frontmatter");
        }

        String name = asString(meta.get("name"));
        String description = asString(meta.get("description"));
        if (name == null || name.isBlank()) {
            throw new AgentDefinitionException("Agent definition is missing required field: name");
        }
        if (description == null || description.isBlank()) {
            throw new AgentDefinitionException("Agent definition is missing required field: description");
        }

        AgentDefinition.AgentDefinitionBuilder builder = AgentDefinition.builder()
                .name(name.trim())
                .description(description.trim())
                .allowedTools(asStringSet(meta.get("tools"), "tools"))
                .tags(asStringSet(meta.get("tags"), "tags"))
                .maxIterations(asInteger(meta.get("maxIterations"), "maxIterations"))
                .temperature(asDouble(meta.get("temperature"), "temperature"))
                .version(asString(meta.get("version")))
                .author(asString(meta.get("author")))
                .systemPrompt(matcher.group(2).trim());

        String model = asString(meta.get("model"));
        if (model != null && !model.isBlank()) {
            builder.model(model.trim());
        }
        Object enabled = meta.get("enabled");
        if (enabled != null) {
            builder.enabled(Boolean.parseBoolean(enabled.toString().trim()));
        }
        return builder.build();
    }

    /**
     * 序列化为定义文件内容，与 {@link #parse(String)} 互逆
     */
    static String serialize(AgentDefinition definition) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("name", definition.getName());
        meta.put("description", definition.getDescription());
        meta.put("model", definition.getModel() != null ? definition.getModel() : AgentDefinition.INHERIT_MODEL);
        if (definition.getAllowedTools() != null) {
            meta.put("tools", definition.getAllowedTools());
        }
        meta.put("enabled", definition.isEnabled());
        putIfPresent(meta, "maxIterations", definition.getMaxIterations());
        putIfPresent(meta, "temperature", definition.getTemperature());
        putIfPresent(meta, "tags", definition.getTags());
        putIfPresent(meta, "version", definition.getVersion());
        putIfPresent(meta, "author", definition.getAuthor());

        String yaml;
        try {
            yaml = YAML_WRITER.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new AgentDefinitionException("Failed to serialize agent definition: " + definition.getName(), e);
        }
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        String body = definition.getSystemPrompt() != null ? definition.getSystemPrompt() : "";
        return "---\n" + yaml + "---\n\n" + body + "\n";
    }

    private static void putIfPresent(Map<String, Object> meta, String key, Object value) {
        if (value != null) {
            meta.put(key, value);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * 接受 YAML 列表或逗号分隔字符串
     */
    private static Set<String> asStringSet(Object value, String field) {
        if (value == null) {
            return null;
        }
        Set<String> result = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                addTrimmed(result, item != null ? item.toString() : null);
            }
        } else if (value instanceof String text) {
            for (String part : text.split(",")) {
                addTrimmed(result, part);
            }
        } else {
            throw new AgentDefinitionException("Field `" + field + "` must be a list or a comma-separated string");
        }
        return result;
    }

    private static void addTrimmed(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.trim());
        }
    }

    private static Integer asInteger(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new AgentDefinitionException("Field `" + field + "` must be an integer: " + value, e);
        }
    }

    private static Double asDouble(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new AgentDefinitionException("Field `" + field + "` must be a number: " + value, e);
        }
    }
}
