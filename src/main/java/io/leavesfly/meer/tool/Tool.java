package io.leavesfly.meer.tool;

import reactor.core.publisher.Mono;

/**
 * 工具接口
 *
 * @param <P> 参数类型，由属性表经 Jackson 转换得到
 */
public interface Tool<P> {

    String getName();

    String getDescription();

    Class<P> getParamsType();

    /**
     * 标签体的用途说明；不使用标签体的工具返回 null
     */
    default String getBodyDescription() {
        return null;
    }

    default ToolKind getKind() {
        return ToolKind.of(getName());
    }

    /**
     * 执行工具
     *
     * @param params 参数
     * @param body   标签体，可能为空串
     */
    Mono<ToolResult> execute(P params, String body);
}
