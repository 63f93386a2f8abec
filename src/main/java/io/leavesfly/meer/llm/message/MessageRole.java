package io.leavesfly.meer.llm.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息角色
 */
public enum MessageRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
