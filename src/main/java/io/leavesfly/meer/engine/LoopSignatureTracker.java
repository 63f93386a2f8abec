package io.leavesfly.meer.engine;

import io.leavesfly.meer.engine.toolcall.ToolInvocation;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 循环签名追踪器
 * <p>
 * 签名 = 每个调用的 "工具名:路径" 按顺序以逗号连接；
 * 路径取 path 属性，没有时取 command 属性。
 * 同一次运行中出现过的签名再次出现即视为模型在原地打转。
 */
@Slf4j
public class LoopSignatureTracker {

    private final Set<String> seenSignatures = new HashSet<>();

    public static String signatureOf(List<ToolInvocation> invocations) {
        return invocations.stream()
                .map(inv -> inv.getToolName() + ":" + keyParam(inv))
                .collect(Collectors.joining(","));
    }

    private static String keyParam(ToolInvocation invocation) {
        String path = invocation.getParam("path");
        if (path != null) {
            return path;
        }
        String command = invocation.getParam("command");
        return command != null ? command : "";
    }

    /**
     * 记录签名
     *
     * @return true 表示此签名之前已出现过
     */
    public boolean checkAndRecord(String signature) {
        boolean repeated = !seenSignatures.add(signature);
        if (repeated) {
            log.warn("Detected repeated tool calls: {}", signature);
        }
        return repeated;
    }
}
