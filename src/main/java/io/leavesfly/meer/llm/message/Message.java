package io.leavesfly.meer.llm.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话消息
 * <p>
 * 一次循环运行内只追加、不修改；
 * 历史列表归创建它的 AgentLoop / SubAgent 独占，不在子代理之间共享。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private MessageRole role;

    private String content;

    public static Message system(String content) {
        return new Message(MessageRole.SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content);
    }
}
