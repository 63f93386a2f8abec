package io.leavesfly.meer.wire.message;

/**
 * Wire 消息标记接口
 */
public interface WireMessage {

    /**
     * 发出消息的子代理名称，主代理为 null
     */
    String getAgentName();

    default boolean isSubagent() {
        return getAgentName() != null;
    }
}
