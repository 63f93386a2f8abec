package io.leavesfly.meer.engine;

import io.leavesfly.meer.config.MeerConfiguration;
import io.leavesfly.meer.engine.approval.AutoEditApprover;
import io.leavesfly.meer.engine.approval.DiffRenderer;
import io.leavesfly.meer.engine.approval.EditDecision;
import io.leavesfly.meer.engine.approval.EditDisposition;
import io.leavesfly.meer.engine.approval.EditReviewSession;
import io.leavesfly.meer.exception.ProviderException;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.ScriptedChatProvider;
import io.leavesfly.meer.llm.message.Message;
import io.leavesfly.meer.llm.message.MessageRole;
import io.leavesfly.meer.tool.ToolFilter;
import io.leavesfly.meer.tool.ToolRegistry;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import io.leavesfly.meer.tool.file.FileEditApplier;
import io.leavesfly.meer.wire.WireImpl;
import io.leavesfly.meer.wire.message.AssistantTextDelta;
import io.leavesfly.meer.wire.message.StepBegin;
import io.leavesfly.meer.wire.message.ToolCallEnd;
import io.leavesfly.meer.wire.message.WireMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AgentLoop 单元测试
 */
class AgentLoopTest {

    @TempDir
    Path workDir;

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        ToolRegistryFactory factory = new ToolRegistryFactory(new MeerConfiguration().objectMapper());
        registry = factory.createStandardRegistry(workDir, ToolFilter.unrestricted("test"), CommandConfirmation.never());
    }

    private AgentLoop.AgentLoopBuilder loop(ChatProvider provider) {
        return AgentLoop.builder()
                .provider(provider)
                .toolRegistry(registry)
                .maxIterations(5);
    }

    @Test
    void testCompletesWithoutToolCalls() {
        // 无工具调用：一次模型调用后完成
        ScriptedChatProvider provider = ScriptedChatProvider.of("Hello! How can I help?");

        LoopResult result = loop(provider).build().run("hi").block();

        assertNotNull(result);
        assertEquals(LoopState.COMPLETED, result.getState());
        assertEquals("Hello! How can I help?", result.getFinalText());
        assertEquals(1, result.getProviderCalls());
        assertEquals(1, provider.getCalls());
        assertEquals(0, result.getToolCallCount());
    }

    @Test
    void testReadFileThenAnswer() throws Exception {
        Files.writeString(workDir.resolve("a.ts"), "export const x = 1;\n");
        ScriptedChatProvider provider = ScriptedChatProvider.of(
                "Reading it.\n<tool name=\"read_file\" path=\"a.ts\"/>",
                "The file exports x.");
        List<Message> history = new ArrayList<>();

        LoopResult result = loop(provider).history(history).build().run("what is in a.ts?").block();

        assertNotNull(result);
        assertTrue(result.isCompleted());
        assertEquals(2, result.getProviderCalls());
        assertEquals(1, result.getToolCallCount());
        assertEquals(Collections.singleton("read_file"), result.getToolsUsed());

        // user, assistant(tool), user(observation), assistant(final)
        assertEquals(4, history.size());
        Message observation = history.get(2);
        assertEquals(MessageRole.USER, observation.getRole());
        assertTrue(observation.getContent().startsWith("Tool Results:\n\nTool: read_file\nResult: File: a.ts"));
        assertTrue(observation.getContent().contains("export const x = 1;"));
    }

    @Test
    void testRepeatedEditAbortsAndStillReviewsCollectedEdit() {
        String edit = "<tool name=\"propose_edit\" path=\"b.txt\" description=\"create\">hello</tool>";
        ScriptedChatProvider provider = ScriptedChatProvider.of(edit, edit, edit);
        EditReviewSession session = new EditReviewSession(AutoEditApprover.skipAll(),
                new FileEditApplier(workDir), new DiffRenderer());

        LoopResult result = loop(provider).reviewSession(session).build().run("create b.txt").block();

        assertNotNull(result);
        assertTrue(result.isAborted());
        assertEquals(LoopResult.AbortReason.REPEATED_TOOL_CALLS, result.getAbortReason());
        assertEquals(2, result.getProviderCalls());
        assertEquals(1, result.getToolCallCount());
        assertEquals(1, result.getProposedEdits().size());
        assertEquals(1, result.getReviewEntries().size());
        assertEquals(EditDisposition.SKIPPED, result.getReviewEntries().get(0).getDisposition());
        assertFalse(Files.exists(workDir.resolve("b.txt")));
    }

    @Test
    void testTimeoutInterruptsIterationsAndSkipsReview() {
        String edit = "<tool name=\"propose_edit\" path=\"c.txt\" description=\"create\">hello</tool>";
        ScriptedChatProvider provider = ScriptedChatProvider.of(edit)
                .thenAfter(Duration.ofSeconds(3), "Done.");
        EditReviewSession session = new EditReviewSession(AutoEditApprover.applyAll(),
                new FileEditApplier(workDir), new DiffRenderer());

        LoopResult result = loop(provider)
                .reviewSession(session)
                .timeout(Duration.ofMillis(200))
                .build()
                .run("create c.txt")
                .block(Duration.ofSeconds(5));

        assertNotNull(result);
        assertTrue(result.isAborted());
        assertTrue(result.isInterrupted());
        assertEquals(LoopResult.AbortReason.TIMEOUT, result.getAbortReason());
        assertEquals("Task timeout after 200ms", result.getErrorMessage());
        assertEquals(1, result.getReviewEntries().size());
        assertEquals(EditDisposition.SKIPPED, result.getReviewEntries().get(0).getDisposition());
        assertFalse(Files.exists(workDir.resolve("c.txt")));
    }

    @Test
    void testTimeoutDoesNotCoverReview() {
        String edit = "<tool name=\"propose_edit\" path=\"d.txt\" description=\"create\">hello</tool>";
        ScriptedChatProvider provider = ScriptedChatProvider.of(edit, "Created d.txt.");
        EditReviewSession session = new EditReviewSession((e, diffLines, index, total) -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return EditDecision.APPLY;
        }, new FileEditApplier(workDir), new DiffRenderer());

        LoopResult result = loop(provider)
                .reviewSession(session)
                .timeout(Duration.ofMillis(300))
                .build()
                .run("create d.txt")
                .block(Duration.ofSeconds(5));

        assertNotNull(result);
        assertTrue(result.isCompleted());
        assertEquals(EditDisposition.APPLIED, result.getReviewEntries().get(0).getDisposition());
        assertTrue(Files.exists(workDir.resolve("d.txt")));
    }

    @Test
    void testSameSignatureNeverRunsThirdRound() {
        // 路径相同、正文不同的调用仍视为重复
        ScriptedChatProvider provider = ScriptedChatProvider.of(
                "<tool name=\"list_files\" path=\".\"/>",
                "<tool name=\"list_files\" path=\".\"></tool>",
                "<tool name=\"list_files\" path=\".\"/>");

        LoopResult result = loop(provider).build().run("list").block();

        assertNotNull(result);
        assertEquals(LoopResult.AbortReason.REPEATED_TOOL_CALLS, result.getAbortReason());
        assertEquals(2, provider.getCalls());
        assertEquals(1, result.getToolCallCount());
    }

    @Test
    void testNonConsecutiveRepeatAlsoAborts() {
        ScriptedChatProvider provider = ScriptedChatProvider.of(
                "<tool name=\"list_files\" path=\"x\"/>",
                "<tool name=\"list_files\" path=\"y\"/>",
                "<tool name=\"list_files\" path=\"x\"/>");

        LoopResult result = loop(provider).build().run("list").block();

        assertNotNull(result);
        assertTrue(result.isAborted());
        assertEquals(3, result.getProviderCalls());
        assertEquals(2, result.getToolCallCount());
    }

    @Test
    void testIterationLimitWithinBound() {
        // 每轮调用不同路径，永不完成
        ScriptedChatProvider provider = new ScriptedChatProvider();
        for (int i = 0; i < 20; i++) {
            provider.then("<tool name=\"list_files\" path=\"dir" + i + "\"/>");
        }

        LoopResult result = loop(provider).maxIterations(3).build().run("go").block();

        assertNotNull(result);
        assertEquals(LoopState.ITERATION_LIMIT_REACHED, result.getState());
        assertTrue(result.getProviderCalls() <= 4);
        assertEquals(3, result.getIterations());
        assertTrue(result.getFinalText().endsWith("[Incomplete: reached the iteration limit of 3]"));
    }

    @Test
    void testTerminatesForAnyShortScript() {
        String[] steps = {
                "<tool name=\"read_file\" path=\"missing.txt\"/>",
                "<tool name=\"unknown_tool\" path=\"z\"/>",
                "<tool name=\"list_files\" path=\".\"/>",
                "final"
        };
        for (int max = 1; max <= 4; max++) {
            ScriptedChatProvider provider = ScriptedChatProvider.of(steps);
            LoopResult result = loop(provider).maxIterations(max).build().run("go").block();

            assertNotNull(result);
            assertTrue(result.getState().isTerminal());
            assertTrue(provider.getCalls() <= max + 1, "calls=" + provider.getCalls() + " max=" + max);
        }
    }

    @Test
    void testProviderFailureAbortsWithoutError() {
        ScriptedChatProvider provider = new ScriptedChatProvider()
                .thenFail(new ProviderException("Unauthorized", 401, null));

        StepVerifier.create(loop(provider).build().run("hi"))
                .assertNext(result -> {
                    assertTrue(result.isAborted());
                    assertEquals(LoopResult.AbortReason.PROVIDER_FAILURE, result.getAbortReason());
                    assertEquals("Unauthorized", result.getErrorMessage());
                    assertEquals(1, result.getProviderCalls());
                })
                .verifyComplete();
    }

    @Test
    void testUnknownToolIsNonFatal() {
        ScriptedChatProvider provider = ScriptedChatProvider.of(
                "<tool name=\"teleport\" path=\"moon\"/>",
                "Sorry, no such tool.");
        List<Message> history = new ArrayList<>();

        LoopResult result = loop(provider).history(history).build().run("go").block();

        assertNotNull(result);
        assertTrue(result.isCompleted());
        assertTrue(history.get(2).getContent().contains("Tool: teleport\nError: Unknown tool: teleport"));
    }

    @Test
    void testDisallowedToolBecomesErrorObservation() {
        ToolRegistryFactory factory = new ToolRegistryFactory(new MeerConfiguration().objectMapper());
        ToolRegistry readOnly = factory.createStandardRegistry(workDir,
                new ToolFilter("reviewer", List.of("read_file")), CommandConfirmation.never());
        ScriptedChatProvider provider = ScriptedChatProvider.of(
                "<tool name=\"run_command\" command=\"ls\"/>",
                "ok");
        List<Message> history = new ArrayList<>();

        LoopResult result = AgentLoop.builder()
                .provider(provider)
                .toolRegistry(readOnly)
                .history(history)
                .build()
                .run("go")
                .block();

        assertNotNull(result);
        assertTrue(result.isCompleted());
        assertTrue(history.get(2).getContent()
                .contains("Tool \"run_command\" is not allowed for agent \"reviewer\""));
    }

    @Test
    void testCancellationBeforeFirstCall() {
        ScriptedChatProvider provider = ScriptedChatProvider.of("never");
        AtomicBoolean cancelled = new AtomicBoolean(true);

        LoopResult result = loop(provider).cancellation(cancelled::get).build().run("go").block();

        assertNotNull(result);
        assertEquals(LoopResult.AbortReason.CANCELLED, result.getAbortReason());
        assertEquals(0, provider.getCalls());
    }

    @Test
    void testRunOnlyOnce() {
        AgentLoop agentLoop = loop(ScriptedChatProvider.of("a", "b")).build();
        agentLoop.run("first").block();

        StepVerifier.create(agentLoop.run("second"))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void testStreamingChunksAreForwardedToWire() {
        ChatProvider streaming = new ChatProvider() {
            @Override
            public Mono<String> chat(List<Message> history) {
                return Mono.error(new AssertionError("chat should not be called"));
            }

            @Override
            public Flux<String> stream(List<Message> history) {
                return Flux.just("Hel", "lo");
            }

            @Override
            public String getModelName() {
                return "stream";
            }
        };
        WireImpl wire = new WireImpl();
        List<WireMessage> received = Collections.synchronizedList(new ArrayList<>());
        wire.asFlux().subscribe(received::add);

        LoopResult result = loop(streaming).wire(wire).agentName("explorer").build().run("hi").block();

        assertNotNull(result);
        assertEquals("Hello", result.getFinalText());
        assertTrue(received.get(0) instanceof StepBegin);
        assertTrue(received.stream().allMatch(WireMessage::isSubagent));
        assertEquals(2, received.stream().filter(m -> m instanceof AssistantTextDelta).count());
    }

    @Test
    void testToolEventsOnWire() {
        WireImpl wire = new WireImpl();
        List<WireMessage> received = Collections.synchronizedList(new ArrayList<>());
        wire.asFlux().subscribe(received::add);
        ScriptedChatProvider provider = ScriptedChatProvider.of("<tool name=\"list_files\" path=\"nope\"/>", "done");

        loop(provider).wire(wire).build().run("go").block();

        ToolCallEnd end = (ToolCallEnd) received.stream()
                .filter(m -> m instanceof ToolCallEnd)
                .findFirst()
                .orElseThrow();
        assertTrue(end.isError());
        assertFalse(end.isSubagent());
    }
}
