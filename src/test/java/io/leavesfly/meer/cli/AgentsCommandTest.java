package io.leavesfly.meer.cli;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.agent.AgentStoreLocations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AgentsCommand 单元测试
 */
class AgentsCommandTest {

    @TempDir
    Path root;

    private AgentRegistry registry;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        registry = new AgentRegistry(new AgentStoreLocations(root.resolve("project"), root.resolve("user"), null));
        registry.loadAgents();
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new AgentsCommand(registry));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void testListWhenEmpty() {
        assertEquals(0, execute("list"));
        assertTrue(out.toString().contains("No agents found."));
    }

    @Test
    void testCreateThenList() {
        int exitCode = execute("create", "--name", "security-auditor", "--description", "Finds vulnerabilities",
                "--tools", "read_file,search_text", "--scope", "user");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(root.resolve("user/security-auditor.md")));
        AgentDefinition created = registry.getAgent("security-auditor").orElseThrow();
        assertEquals(Set.of("read_file", "search_text"), created.getAllowedTools());
        assertEquals(AgentsCommand.defaultPrompt("security-auditor", "Finds vulnerabilities"),
                created.getSystemPrompt());

        assertEquals(0, execute("list"));
        assertTrue(out.toString().contains("security-auditor"));
        assertTrue(out.toString().contains("Total: 1"));
    }

    @Test
    void testCreateRejectsInvalidName() {
        assertEquals(1, execute("create", "--name", "Bad Name", "--description", "x"));
        assertTrue(err.toString().startsWith("Error: Invalid agent name: Bad Name"));
    }

    @Test
    void testShowDisableAndDelete() {
        execute("create", "--name", "helper", "--description", "Helps out", "--prompt", "Be helpful.");

        assertEquals(0, execute("show", "helper"));
        assertTrue(out.toString().contains("Description: Helps out"));
        assertTrue(out.toString().contains("Tools:       (all)"));
        assertTrue(out.toString().contains("Be helpful."));

        assertEquals(0, execute("disable", "helper"));
        assertFalse(registry.getAgent("helper").orElseThrow().isEnabled());

        assertEquals(0, execute("delete", "helper"));
        assertFalse(registry.hasAgent("helper"));
    }

    @Test
    void testUnknownAgent() {
        assertEquals(1, execute("show", "ghost"));
        assertTrue(err.toString().contains("Agent not found: ghost"));
        assertEquals(1, execute("enable", "ghost"));
        assertEquals(1, execute("delete", "ghost", "--scope", "builtin"));
    }
}
