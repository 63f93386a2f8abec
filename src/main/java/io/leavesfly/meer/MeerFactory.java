package io.leavesfly.meer;

import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.agent.AgentStoreLocations;
import io.leavesfly.meer.config.MeerConfig;
import io.leavesfly.meer.config.ShellUIConfig;
import io.leavesfly.meer.engine.MeerEngine;
import io.leavesfly.meer.engine.approval.AutoEditApprover;
import io.leavesfly.meer.engine.approval.DiffRenderer;
import io.leavesfly.meer.engine.approval.EditApprover;
import io.leavesfly.meer.engine.subagent.AgentExecutionConfig;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.LLMFactory;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.tool.ToolRegistry;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import io.leavesfly.meer.tool.file.FileEditApplier;
import io.leavesfly.meer.wire.Wire;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Meer 应用工厂（Spring Service）
 * 负责按命令行参数组装编排器和主代理
 * <p>
 * 配置和模型提供商延迟获取，agents 管理类命令不需要有效的模型配置。
 */
@Slf4j
@Service
public class MeerFactory {

    private final ObjectProvider<MeerConfig> configProvider;
    private final ObjectProvider<LLMFactory> llmFactoryProvider;
    private final ToolRegistryFactory toolRegistryFactory;
    private final AgentRegistry defaultRegistry;
    private final ShellUIConfig shellUIConfig;

    public MeerFactory(ObjectProvider<MeerConfig> configProvider,
                       ObjectProvider<LLMFactory> llmFactoryProvider,
                       ToolRegistryFactory toolRegistryFactory,
                       AgentRegistry defaultRegistry,
                       ShellUIConfig shellUIConfig) {
        this.configProvider = configProvider;
        this.llmFactoryProvider = llmFactoryProvider;
        this.toolRegistryFactory = toolRegistryFactory;
        this.defaultRegistry = defaultRegistry;
        this.shellUIConfig = shellUIConfig;
    }

    /**
     * 工作目录对应的注册表；与启动目录一致时复用 Spring 管理的实例
     */
    public AgentRegistry registryFor(Path workDir) {
        AgentStoreLocations defaults = defaultRegistry.getLocations();
        AgentStoreLocations wanted = AgentStoreLocations.defaults(workDir.toAbsolutePath().normalize());
        if (wanted.getProjectDir().equals(defaults.getProjectDir().toAbsolutePath().normalize())) {
            return defaultRegistry;
        }
        log.debug("Using agent registry rooted at {}", wanted.getProjectDir());
        AgentRegistry registry = new AgentRegistry(wanted);
        registry.loadAgents();
        return registry;
    }

    /**
     * 创建编排器
     *
     * @param approver     交互式编辑审批，yolo / dry-run 时被覆盖
     * @param confirmation 交互式命令确认，yolo 时被覆盖
     */
    public AgentOrchestrator createOrchestrator(SessionOptions options, EditApprover approver,
                                                CommandConfirmation confirmation, Wire wire) {
        MeerConfig config = configProvider.getObject();
        LLMFactory llmFactory = llmFactoryProvider.getObject();
        Path workDir = options.getWorkDir().toAbsolutePath().normalize();

        AgentExecutionConfig executionConfig = AgentExecutionConfig.builder()
                .defaultProvider(resolveProvider(options, llmFactory))
                .modelResolver(llmFactory::getOrCreate)
                .toolRegistryFactory(toolRegistryFactory)
                .workDir(workDir)
                .defaultMaxIterations(resolveMaxIterations(options, config))
                .defaultTimeoutMs(config.getOrchestrator().getDefaultTimeoutMs())
                .editApprover(effectiveApprover(options, approver))
                .editApplier(new FileEditApplier(workDir))
                .diffRenderer(createDiffRenderer())
                .commandConfirmation(effectiveConfirmation(options, confirmation))
                .wire(wire)
                .build();

        return new AgentOrchestrator(registryFor(workDir), executionConfig);
    }

    /**
     * 创建主代理，工具集包含 delegate_task
     */
    public MeerEngine createEngine(SessionOptions options, EditApprover approver,
                                   CommandConfirmation confirmation, Wire wire) {
        MeerConfig config = configProvider.getObject();
        LLMFactory llmFactory = llmFactoryProvider.getObject();
        Path workDir = options.getWorkDir().toAbsolutePath().normalize();

        AgentOrchestrator orchestrator = createOrchestrator(options, approver, confirmation, wire);
        CommandConfirmation effectiveConfirmation = effectiveConfirmation(options, confirmation);
        ToolRegistry toolRegistry = toolRegistryFactory.createMainRegistry(workDir, effectiveConfirmation, orchestrator);
        ChatProvider provider = resolveProvider(options, llmFactory);

        log.info("Creating engine with model {} in {}", provider.getModelName(), workDir);
        return MeerEngine.builder()
                .provider(provider)
                .toolRegistry(toolRegistry)
                .orchestrator(orchestrator)
                .workDir(workDir)
                .maxIterations(resolveMaxIterations(options, config))
                .wire(wire)
                .editApprover(effectiveApprover(options, approver))
                .editApplier(new FileEditApplier(workDir))
                .diffRenderer(createDiffRenderer())
                .build();
    }

    private ChatProvider resolveProvider(SessionOptions options, LLMFactory llmFactory) {
        if (options.getModelName() != null && !options.getModelName().isEmpty()) {
            return llmFactory.getOrCreate(options.getModelName());
        }
        return llmFactory.getDefault();
    }

    private int resolveMaxIterations(SessionOptions options, MeerConfig config) {
        if (options.getMaxIterations() != null && options.getMaxIterations() > 0) {
            return options.getMaxIterations();
        }
        return config.getLoopControl().getMaxIterations();
    }

    private EditApprover effectiveApprover(SessionOptions options, EditApprover approver) {
        if (options.isDryRun()) {
            return AutoEditApprover.skipAll();
        }
        if (options.isYolo()) {
            return AutoEditApprover.applyAll();
        }
        return approver != null ? approver : AutoEditApprover.skipAll();
    }

    private CommandConfirmation effectiveConfirmation(SessionOptions options, CommandConfirmation confirmation) {
        if (options.isDryRun()) {
            return CommandConfirmation.never();
        }
        if (options.isYolo()) {
            return CommandConfirmation.always();
        }
        return confirmation != null ? confirmation : CommandConfirmation.never();
    }

    private DiffRenderer createDiffRenderer() {
        return new DiffRenderer(shellUIConfig.getNewFilePreviewLines(), shellUIConfig.getMaxDiffLines());
    }
}
