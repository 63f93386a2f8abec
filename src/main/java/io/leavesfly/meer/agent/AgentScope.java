package io.leavesfly.meer.agent;

import java.util.Locale;

/**
 * Agent 定义的存储层级，声明顺序即优先级（高到低）
 */
public enum AgentScope {

    PROJECT,

    USER,

    BUILTIN;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isWritable() {
        return this != BUILTIN;
    }

    /**
     * @throws IllegalArgumentException 未知层级
     */
    public static AgentScope fromValue(String value) {
        for (AgentScope scope : values()) {
            if (scope.getValue().equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown scope: " + value + " (expected project, user or builtin)");
    }

    @Override
    public String toString() {
        return getValue();
    }
}
