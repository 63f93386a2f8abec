package io.leavesfly.meer.orchestrator;

import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.agent.AgentStoreLocations;
import io.leavesfly.meer.config.MeerConfiguration;
import io.leavesfly.meer.engine.approval.EditApprover;
import io.leavesfly.meer.engine.approval.EditDecision;
import io.leavesfly.meer.engine.approval.EditDisposition;
import io.leavesfly.meer.engine.approval.EditReviewEntry;
import io.leavesfly.meer.engine.subagent.AgentExecutionConfig;
import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.engine.subagent.SubAgentStatus;
import io.leavesfly.meer.engine.subagent.SubAgentStatusInfo;
import io.leavesfly.meer.exception.AgentDisabledException;
import io.leavesfly.meer.exception.AgentNotFoundException;
import io.leavesfly.meer.exception.ProviderException;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.ScriptedChatProvider;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import io.leavesfly.meer.tool.file.FileEditApplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.Disposable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AgentOrchestrator 单元测试
 */
class AgentOrchestratorTest {

    private static final String PROPOSE_OUT =
            "<tool name=\"propose_edit\" path=\"out.txt\" description=\"create\">hello</tool>";

    @TempDir
    Path workDir;

    private AgentRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        Path agentsDir = Files.createDirectories(workDir.resolve(".meer/agents"));
        Files.writeString(agentsDir.resolve("reviewer.md"),
                "---\nname: reviewer\ndescription: Reviews code\ntools: [read_file]\n---\nReview the code.");
        Files.writeString(agentsDir.resolve("retired.md"),
                "---\nname: retired\ndescription: No longer used\nenabled: false\n---\nUnused.");
        Files.writeString(agentsDir.resolve("writer.md"),
                "---\nname: writer\ndescription: Writes files\ntools: [propose_edit]\n---\nWrite the file.");
        registry = new AgentRegistry(new AgentStoreLocations(agentsDir, workDir.resolve("user"), null));
        registry.loadAgents();
    }

    private AgentOrchestrator orchestrator(ScriptedChatProvider provider) {
        AgentExecutionConfig config = AgentExecutionConfig.builder()
                .defaultProvider(provider)
                .toolRegistryFactory(new ToolRegistryFactory(new MeerConfiguration().objectMapper()))
                .workDir(workDir)
                .defaultTimeoutMs(5_000L)
                .build();
        return new AgentOrchestrator(registry, config);
    }

    /**
     * 带编辑审核的编排器，model 为 broken / slow 的子代理使用各自的提供商
     */
    private AgentOrchestrator orchestrator(ChatProvider provider, EditApprover approver,
                                           Map<String, ChatProvider> providersByModel) {
        AgentExecutionConfig config = AgentExecutionConfig.builder()
                .defaultProvider(provider)
                .modelResolver(model -> providersByModel.getOrDefault(model, provider))
                .toolRegistryFactory(new ToolRegistryFactory(new MeerConfiguration().objectMapper()))
                .workDir(workDir)
                .defaultTimeoutMs(5_000L)
                .editApprover(approver)
                .editApplier(new FileEditApplier(workDir))
                .build();
        return new AgentOrchestrator(registry, config);
    }

    @Test
    void testDelegateTaskSuccess() throws InterruptedException {
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of("No issues found."));

        SubAgentResult result = orchestrator.delegateTask("reviewer", "Review Main.java").block();

        assertNotNull(result);
        assertTrue(result.isSuccess());
        assertEquals("reviewer", result.getAgentName());
        assertEquals("No issues found.", result.getOutput());
        assertTrue(awaitIdle(orchestrator));
    }

    @Test
    void testDisabledAgentIsRejectedBeforeExecution() {
        ScriptedChatProvider provider = ScriptedChatProvider.of("unused");
        AgentOrchestrator orchestrator = orchestrator(provider);

        AgentDisabledException e = assertThrows(AgentDisabledException.class,
                () -> orchestrator.delegateTask("retired", "anything"));

        assertEquals("Agent is disabled: retired", e.getMessage());
        assertTrue(orchestrator.getAllActiveAgents().isEmpty());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void testUnknownAgentIsRejected() {
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of());

        AgentNotFoundException e = assertThrows(AgentNotFoundException.class,
                () -> orchestrator.delegateTask("ghost", "anything"));

        assertEquals("Agent not found: ghost", e.getMessage());
    }

    @Test
    void testTimeout() throws InterruptedException {
        ScriptedChatProvider provider = ScriptedChatProvider.of("too late").withDelay(Duration.ofMillis(100));
        AgentOrchestrator orchestrator = orchestrator(provider);

        SubAgentResult result = orchestrator
                .delegateTask("reviewer", "Review slowly", DelegationOptions.withTimeout(1))
                .block(Duration.ofSeconds(5));

        assertNotNull(result);
        assertFalse(result.isSuccess());
        assertTrue(result.isTimeout());
        assertEquals(SubAgentResult.FailureType.TIMEOUT, result.getFailureType());
        assertEquals("Task timeout after 1ms", result.getError());
        assertTrue(awaitIdle(orchestrator));
    }

    @Test
    void testReviewTimeIsNotCountedAgainstTimeout() throws IOException, InterruptedException {
        AtomicInteger prompts = new AtomicInteger();
        EditApprover slowApprover = (edit, diffLines, index, total) -> {
            prompts.incrementAndGet();
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return EditDecision.APPLY;
        };
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of(PROPOSE_OUT, "Wrote out.txt."),
                slowApprover, Map.of());

        SubAgentResult result = orchestrator
                .delegateTask("writer", "Create out.txt", DelegationOptions.withTimeout(500))
                .block(Duration.ofSeconds(10));

        assertNotNull(result);
        assertTrue(result.isSuccess());
        assertEquals(1, prompts.get());
        assertEquals(1, result.getEditReview().size());
        assertEquals(EditDisposition.APPLIED, result.getEditReview().get(0).getDisposition());
        assertEquals("hello", Files.readString(workDir.resolve("out.txt")));
        assertTrue(awaitIdle(orchestrator));
    }

    @Test
    void testTimeoutSkipsCollectedEditsWithoutPrompting() throws InterruptedException {
        AtomicInteger prompts = new AtomicInteger();
        EditApprover approver = (edit, diffLines, index, total) -> {
            prompts.incrementAndGet();
            return EditDecision.APPLY;
        };
        ScriptedChatProvider provider = ScriptedChatProvider.of(PROPOSE_OUT)
                .thenAfter(Duration.ofSeconds(3), "Wrote out.txt.");
        AgentOrchestrator orchestrator = orchestrator(provider, approver, Map.of());

        SubAgentResult result = orchestrator
                .delegateTask("writer", "Create out.txt", DelegationOptions.withTimeout(300))
                .block(Duration.ofSeconds(10));

        assertNotNull(result);
        assertFalse(result.isSuccess());
        assertEquals(SubAgentResult.FailureType.TIMEOUT, result.getFailureType());
        assertEquals("Task timeout after 300ms", result.getError());
        List<EditReviewEntry> review = result.getEditReview();
        assertEquals(1, review.size());
        assertEquals(EditDisposition.SKIPPED, review.get(0).getDisposition());
        assertEquals(0, prompts.get());
        assertFalse(Files.exists(workDir.resolve("out.txt")));
        assertTrue(awaitIdle(orchestrator));
    }

    @Test
    void testActiveAgentTrackingAndAbort() throws InterruptedException {
        ScriptedChatProvider provider = ScriptedChatProvider.of("finished").withDelay(Duration.ofMillis(500));
        AgentOrchestrator orchestrator = orchestrator(provider);

        Disposable subscription = orchestrator.delegateTask("reviewer", "Review").subscribe();
        try {
            List<SubAgentStatusInfo> active = awaitActive(orchestrator);
            assertEquals(1, active.size());
            SubAgentStatusInfo info = active.get(0);
            assertEquals("reviewer", info.getAgentName());
            assertEquals(SubAgentStatus.RUNNING, info.getStatus());
            assertTrue(orchestrator.getAgentStatus(info.getId()).isPresent());

            assertTrue(orchestrator.abortAgent(info.getId()));
            assertFalse(orchestrator.abortAgent("agent_missing"));
        } finally {
            subscription.dispose();
        }
    }

    @Test
    void testParallelKeepsInputOrderAndConvertsRejections() {
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of().withFallback("Reviewed."));
        List<ParallelTask> tasks = List.of(
                new ParallelTask("reviewer", "Review A"),
                new ParallelTask("ghost", "Review B"),
                new ParallelTask("retired", "Review C"),
                new ParallelTask("reviewer", "Review D"));

        List<SubAgentResult> results = orchestrator.delegateParallel(tasks).block(Duration.ofSeconds(10));

        assertNotNull(results);
        assertEquals(4, results.size());
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(3).isSuccess());

        SubAgentResult unknown = results.get(1);
        assertFalse(unknown.isSuccess());
        assertEquals("ghost", unknown.getAgentName());
        assertEquals(SubAgentResult.FailureType.DELEGATION_ERROR, unknown.getFailureType());
        assertEquals("Parallel execution failed: Agent not found: ghost", unknown.getSummary());

        SubAgentResult disabled = results.get(2);
        assertFalse(disabled.isSuccess());
        assertEquals("Agent is disabled: retired", disabled.getError());
    }

    @Test
    void testParallelIsolatesExecutionFailures() throws IOException, InterruptedException {
        Path agentsDir = workDir.resolve(".meer/agents");
        Files.writeString(agentsDir.resolve("flaky.md"),
                "---\nname: flaky\ndescription: Always fails\nmodel: broken\n---\nFail.");
        Files.writeString(agentsDir.resolve("sluggish.md"),
                "---\nname: sluggish\ndescription: Never answers in time\nmodel: slow\n---\nWait.");
        registry.loadAgents();

        Map<String, ChatProvider> providers = Map.of(
                "broken", ScriptedChatProvider.of().thenFail(new ProviderException("upstream 500")),
                "slow", ScriptedChatProvider.of().thenAfter(Duration.ofSeconds(3), "late"));
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of().withFallback("Reviewed."),
                null, providers);
        List<ParallelTask> tasks = List.of(
                new ParallelTask("reviewer", "Review A"),
                new ParallelTask("flaky", "Review B"),
                new ParallelTask("sluggish", "Review C", DelegationOptions.withTimeout(200)),
                new ParallelTask("reviewer", "Review D"));

        List<SubAgentResult> results = orchestrator.delegateParallel(tasks).block(Duration.ofSeconds(10));

        assertNotNull(results);
        assertEquals(4, results.size());
        assertEquals("reviewer", results.get(0).getAgentName());
        assertTrue(results.get(0).isSuccess());
        assertEquals("Reviewed.", results.get(0).getOutput());

        SubAgentResult failed = results.get(1);
        assertEquals("flaky", failed.getAgentName());
        assertFalse(failed.isSuccess());
        assertEquals(SubAgentResult.FailureType.PROVIDER_FAILURE, failed.getFailureType());
        assertEquals("Provider failure: upstream 500", failed.getError());

        SubAgentResult timedOut = results.get(2);
        assertEquals("sluggish", timedOut.getAgentName());
        assertEquals(SubAgentResult.FailureType.TIMEOUT, timedOut.getFailureType());
        assertEquals("Task timeout after 200ms", timedOut.getError());

        assertEquals("reviewer", results.get(3).getAgentName());
        assertTrue(results.get(3).isSuccess());
        assertTrue(awaitIdle(orchestrator));
    }

    @Test
    void testParallelWithNoTasks() {
        List<SubAgentResult> results = orchestrator(ScriptedChatProvider.of())
                .delegateParallel(List.of())
                .block();

        assertNotNull(results);
        assertTrue(results.isEmpty());
    }

    @Test
    void testListingAndSearch() {
        AgentOrchestrator orchestrator = orchestrator(ScriptedChatProvider.of());

        assertEquals(3, orchestrator.listAvailableAgents().size());
        assertEquals(2, orchestrator.listEnabledAgents().size());
        assertEquals("retired", orchestrator.searchAgents("no longer").get(0).getName());
        assertTrue(orchestrator.getAgentDefinition("reviewer").isPresent());
    }

    private static boolean awaitIdle(AgentOrchestrator orchestrator) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000L;
        while (!orchestrator.getAllActiveAgents().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        return orchestrator.getAllActiveAgents().isEmpty();
    }

    private static List<SubAgentStatusInfo> awaitActive(AgentOrchestrator orchestrator) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000L;
        List<SubAgentStatusInfo> active = orchestrator.getAllActiveAgents();
        while (active.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            active = orchestrator.getAllActiveAgents();
        }
        return active;
    }
}
