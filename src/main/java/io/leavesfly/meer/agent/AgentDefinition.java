package io.leavesfly.meer.agent;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Agent 定义
 * <p>
 * 加载后不可变，以 name 为唯一标识；生命周期由磁盘文件决定。
 */
@Value
@Builder(toBuilder = true)
public class AgentDefinition {

    public static final String INHERIT_MODEL = "inherit";

    String name;

    String description;

    /**
     * "inherit" 表示沿用主代理的模型
     */
    @Builder.Default
    String model = INHERIT_MODEL;

    /**
     * 工具白名单，null 表示不限制
     */
    Set<String> allowedTools;

    @Builder.Default
    boolean enabled = true;

    Integer maxIterations;

    Double temperature;

    /**
     * 系统提示词正文
     */
    @Builder.Default
    String systemPrompt = "";

    Set<String> tags;

    String version;

    String author;

    public boolean inheritsModel() {
        return model == null || model.isEmpty() || INHERIT_MODEL.equals(model);
    }
}
