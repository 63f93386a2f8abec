package io.leavesfly.meer.orchestrator;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.agent.AgentDiscoveryResult;
import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.engine.subagent.AgentExecutionConfig;
import io.leavesfly.meer.engine.subagent.SubAgent;
import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.engine.subagent.SubAgentStatusInfo;
import io.leavesfly.meer.exception.AgentDisabledException;
import io.leavesfly.meer.exception.AgentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Agent 编排器
 * <p>
 * 职责：
 * - 把任务委托给注册表中的子代理，带超时
 * - 并行委托多个任务，结果与输入一一对应
 * - 跟踪正在运行的子代理，供 UI 查询进度
 * <p>
 * 查找和校验错误在 delegateTask 返回之前同步抛出；执行期间的错误都收敛为失败结果。
 * 超时交给子代理的 Agent 循环执行，只限制模型调用和工具执行，人工审核编辑的时间不计入。
 */
@Slf4j
public class AgentOrchestrator {

    private final AgentRegistry registry;
    private final AgentExecutionConfig config;
    private final Map<String, SubAgent> activeAgents = new ConcurrentHashMap<>();

    public AgentOrchestrator(AgentRegistry registry, AgentExecutionConfig config) {
        this.registry = registry;
        this.config = config;
    }

    /**
     * 委托单个任务
     *
     * @throws AgentNotFoundException 子代理不存在
     * @throws AgentDisabledException 子代理已禁用
     */
    public Mono<SubAgentResult> delegateTask(String agentName, String task, DelegationOptions options) {
        AgentDefinition definition = registry.getAgent(agentName)
                .orElseThrow(() -> new AgentNotFoundException("Agent not found: " + agentName));
        if (!definition.isEnabled()) {
            throw new AgentDisabledException("Agent is disabled: " + agentName);
        }

        DelegationOptions opts = options != null ? options : DelegationOptions.defaults();
        long timeoutMs = resolveTimeout(opts);

        return Mono.defer(() -> {
            SubAgent subAgent = new SubAgent(definition, config);
            activeAgents.put(subAgent.getId(), subAgent);
            log.info("Delegating to {} ({}) with timeout {}ms", agentName, subAgent.getId(), timeoutMs);

            return subAgent.execute(task, opts.getContext(), timeoutMs)
                    .doOnCancel(subAgent::abort)
                    .doFinally(signal -> activeAgents.remove(subAgent.getId()));
        });
    }

    public Mono<SubAgentResult> delegateTask(String agentName, String task) {
        return delegateTask(agentName, task, DelegationOptions.defaults());
    }

    /**
     * 并行委托
     * <p>
     * 等待所有任务结束；委托阶段被拒绝的任务也转换为失败结果，返回列表与输入顺序一致
     */
    public Mono<List<SubAgentResult>> delegateParallel(List<ParallelTask> tasks) {
        log.info("Delegating {} task(s) in parallel", tasks.size());
        return Flux.fromIterable(tasks)
                .flatMapSequential(task -> Mono
                        .defer(() -> delegateTask(task.getAgentName(), task.getTask(), task.getOptions()))
                        .onErrorResume(e -> Mono.just(rejected(task, e))))
                .collectList();
    }

    public String aggregateResults(List<SubAgentResult> results) {
        return ResultAggregator.aggregate(results);
    }

    public List<AgentDefinition> listAvailableAgents() {
        return registry.getAllAgents().stream()
                .map(AgentDiscoveryResult::getDefinition)
                .collect(Collectors.toList());
    }

    public List<AgentDefinition> listEnabledAgents() {
        return registry.getEnabledAgents().stream()
                .map(AgentDiscoveryResult::getDefinition)
                .collect(Collectors.toList());
    }

    public List<AgentDefinition> searchAgents(String query) {
        return registry.searchAgents(query).stream()
                .map(AgentDiscoveryResult::getDefinition)
                .collect(Collectors.toList());
    }

    public Optional<AgentDefinition> getAgentDefinition(String name) {
        return registry.getAgent(name);
    }

    public Optional<SubAgentStatusInfo> getAgentStatus(String id) {
        SubAgent subAgent = activeAgents.get(id);
        return subAgent != null ? Optional.of(subAgent.getStatusInfo()) : Optional.empty();
    }

    public List<SubAgentStatusInfo> getAllActiveAgents() {
        return activeAgents.values().stream()
                .map(SubAgent::getStatusInfo)
                .collect(Collectors.toList());
    }

    /**
     * @return 找到并中止了对应子代理时返回 true
     */
    public boolean abortAgent(String id) {
        SubAgent subAgent = activeAgents.get(id);
        if (subAgent == null) {
            return false;
        }
        subAgent.abort();
        return true;
    }

    public AgentRegistry getRegistry() {
        return registry;
    }

    private long resolveTimeout(DelegationOptions options) {
        if (options.getTimeoutMs() != null && options.getTimeoutMs() > 0) {
            return options.getTimeoutMs();
        }
        return config.getDefaultTimeoutMs();
    }

    private SubAgentResult rejected(ParallelTask task, Throwable e) {
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.warn("Parallel task for {} rejected: {}", task.getAgentName(), reason);
        return SubAgentResult.failure(task.getAgentName(), reason, SubAgentResult.FailureType.DELEGATION_ERROR)
                .toBuilder()
                .summary("Parallel execution failed: " + reason)
                .build();
    }
}
