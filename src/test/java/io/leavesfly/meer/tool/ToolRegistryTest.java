package io.leavesfly.meer.tool;

import io.leavesfly.meer.config.MeerConfiguration;
import io.leavesfly.meer.engine.toolcall.ToolInvocation;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ToolRegistry 单元测试
 */
class ToolRegistryTest {

    @TempDir
    Path workDir;

    private final ToolRegistryFactory factory = new ToolRegistryFactory(new MeerConfiguration().objectMapper());

    private static ToolInvocation call(String tool, Map<String, String> params) {
        return ToolInvocation.builder().toolName(tool).params(params).build();
    }

    @Test
    void testStandardRegistryHasNoDelegateTool() {
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                ToolFilter.unrestricted("main"), CommandConfirmation.never());

        assertTrue(registry.hasTool("read_file"));
        assertTrue(registry.hasTool("propose_edit"));
        assertTrue(registry.hasTool("run_command"));
        assertFalse(registry.hasTool("delegate_task"));
    }

    @Test
    void testToolNamesFollowWhitelist() {
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                new ToolFilter("reviewer", Set.of("read_file", "list_files")), CommandConfirmation.never());

        assertEquals(Set.of("read_file", "list_files"), Set.copyOf(registry.getToolNames()));
        String description = registry.describeTools();
        assertTrue(description.contains("### read_file"));
        assertTrue(description.contains("path (required)"));
        assertFalse(description.contains("### run_command"));
    }

    @Test
    void testExecuteReadFile() throws Exception {
        Files.writeString(workDir.resolve("a.txt"), "hello");
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                ToolFilter.unrestricted("main"), CommandConfirmation.never());

        ToolResult result = registry.execute(call("read_file", Map.of("path", "a.txt"))).block();

        assertNotNull(result);
        assertFalse(result.isError());
        assertTrue(result.getOutput().endsWith("hello"));
    }

    @Test
    void testDisallowedToolBecomesErrorResult() {
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                new ToolFilter("reviewer", List.of("read_file")), CommandConfirmation.always());

        ToolResult result = registry.execute(call("run_command", Map.of("command", "echo hi"))).block();

        assertNotNull(result);
        assertTrue(result.isError());
        assertTrue(result.getMessage().startsWith("Tool \"run_command\" is not allowed for agent \"reviewer\""));
    }

    @Test
    void testUnknownToolBecomesErrorResult() {
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                ToolFilter.unrestricted("main"), CommandConfirmation.never());

        ToolResult result = registry.execute(call("teleport", Map.of())).block();

        assertNotNull(result);
        assertTrue(result.isError());
        assertTrue(result.getMessage().startsWith("Unknown tool: teleport. Available tools: "));
    }

    @Test
    void testInvalidParamsBecomeErrorResult() {
        ToolRegistry registry = factory.createStandardRegistry(workDir,
                ToolFilter.unrestricted("main"), CommandConfirmation.never());

        ToolResult result = registry.execute(call("run_command", Map.of("command", "ls", "timeout", "soon"))).block();

        assertNotNull(result);
        assertTrue(result.isError());
        assertTrue(result.getMessage().startsWith("Invalid parameters for tool run_command"));
    }

    @Test
    void testObservationText() {
        assertEquals("out", ToolResult.ok("out", "msg").toObservationText());
        assertEquals("msg", ToolResult.ok("", "msg").toObservationText());
        assertEquals("failed", ToolResult.error("failed").toObservationText());
        assertEquals("failed\npartial", ToolResult.error("partial", "failed").toObservationText());
    }
}
