package io.leavesfly.meer.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.tool.bash.Bash;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import io.leavesfly.meer.tool.file.Glob;
import io.leavesfly.meer.tool.file.Grep;
import io.leavesfly.meer.tool.file.ListFiles;
import io.leavesfly.meer.tool.file.ProposeEdit;
import io.leavesfly.meer.tool.file.ReadFile;
import io.leavesfly.meer.tool.task.DelegateTask;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * ToolRegistry 工厂类
 * 负责创建绑定了工作目录和白名单的 ToolRegistry 实例
 */
@Slf4j
public class ToolRegistryFactory {

    private final ObjectMapper objectMapper;

    public ToolRegistryFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 创建标准工具注册表（不含 delegate_task），子代理使用
     *
     * @param workDir      工作目录
     * @param filter       白名单
     * @param confirmation 命令执行确认
     */
    public ToolRegistry createStandardRegistry(Path workDir, ToolFilter filter, CommandConfirmation confirmation) {
        ToolRegistry registry = new ToolRegistry(objectMapper, filter);

        registry.register(new ReadFile(workDir));
        registry.register(new ListFiles(workDir));
        registry.register(new ProposeEdit(workDir));
        registry.register(new Glob(workDir));
        registry.register(new Grep(workDir));
        registry.register(new Bash(workDir, confirmation));

        log.debug("Created tool registry for {} with tools {}", filter.getAgentName(), registry.getToolNames());
        return registry;
    }

    /**
     * 创建主代理的工具注册表，额外提供 delegate_task
     */
    public ToolRegistry createMainRegistry(Path workDir, CommandConfirmation confirmation,
                                           AgentOrchestrator orchestrator) {
        ToolRegistry registry = createStandardRegistry(workDir, ToolFilter.unrestricted("main"), confirmation);
        if (orchestrator != null) {
            registry.register(new DelegateTask(orchestrator, workDir));
        }
        log.info("Created main tool registry with {} tools", registry.getToolNames().size());
        return registry;
    }
}
