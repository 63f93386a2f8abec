package io.leavesfly.meer.command;

import io.leavesfly.meer.command.handlers.ResetCommandHandler;
import io.leavesfly.meer.command.handlers.VersionCommandHandler;
import io.leavesfly.meer.engine.MeerEngine;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CommandRegistry 单元测试
 */
class CommandRegistryTest {

    private final CommandRegistry registry = new CommandRegistry(
            List.of(new VersionCommandHandler(), new ResetCommandHandler()));

    @Test
    void testFindByNameAndAlias() {
        assertEquals("reset", registry.find("reset").orElseThrow().getName());
        assertEquals("reset", registry.find("clear").orElseThrow().getName());
        assertEquals("version", registry.find("v").orElseThrow().getName());
        assertTrue(registry.find("unknown").isEmpty());
        assertEquals(2, registry.size());
    }

    @Test
    void testHandlersSortedByName() {
        assertEquals(List.of("reset", "version"), registry.getHandlers().stream()
                .map(CommandHandler::getName)
                .collect(Collectors.toList()));
        assertEquals(List.of("/reset", "/version", "/clear", "/v"), registry.getCompletionCandidates());
    }

    @Test
    void testResetClearsEngineHistory() throws Exception {
        MeerEngine engine = mock(MeerEngine.class);
        OutputFormatter formatter = mock(OutputFormatter.class);
        CommandContext context = CommandContext.builder()
                .engine(engine)
                .outputFormatter(formatter)
                .commandName("clear")
                .args(new String[0])
                .build();

        registry.find("clear").orElseThrow().execute(context);

        verify(engine).reset();
        verify(formatter).printSuccess(anyString());
    }

    @Test
    void testContextArgs() {
        CommandContext context = CommandContext.builder()
                .args(new String[]{"explorer", "map", "the", "repo"})
                .build();

        assertEquals(4, context.getArgCount());
        assertEquals("explorer", context.getArg(0));
        assertNull(context.getArg(9));
        assertEquals("explorer map the repo", context.getArgsAsString());
        assertEquals("", CommandContext.builder().build().getArgsAsString());
    }
}
