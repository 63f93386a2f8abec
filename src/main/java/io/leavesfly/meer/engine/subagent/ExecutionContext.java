package io.leavesfly.meer.engine.subagent;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 子代理执行上下文
 */
@Getter
@Builder
public class ExecutionContext {

    /**
     * 工作目录描述，写入任务消息
     */
    private final String cwd;

    /**
     * 相关文件
     */
    @Builder.Default
    private final List<String> files = Collections.emptyList();

    /**
     * 附加到系统提示词的键值对
     */
    @Builder.Default
    private final Map<String, String> metadata = Collections.emptyMap();

    public static ExecutionContext empty() {
        return ExecutionContext.builder().build();
    }
}
