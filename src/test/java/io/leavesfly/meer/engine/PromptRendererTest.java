package io.leavesfly.meer.engine;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.config.MeerConfiguration;
import io.leavesfly.meer.tool.ToolFilter;
import io.leavesfly.meer.tool.ToolRegistry;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PromptRenderer 单元测试
 */
class PromptRendererTest {

    @TempDir
    Path workDir;

    private ToolRegistry registry(ToolFilter filter) {
        return new ToolRegistryFactory(new MeerConfiguration().objectMapper())
                .createStandardRegistry(workDir, filter, CommandConfirmation.never());
    }

    @Test
    void testMainPromptHasNoUnresolvedPlaceholders() throws Exception {
        Files.createDirectories(workDir.resolve("src"));
        Files.writeString(workDir.resolve("pom.xml"), "<project/>");
        List<AgentDefinition> agents = List.of(AgentDefinition.builder()
                .name("explorer")
                .description("Explores code")
                .build());

        String prompt = PromptRenderer.renderMainPrompt(workDir, registry(ToolFilter.unrestricted("main")), agents);

        assertFalse(prompt.contains("${MEER_"));
        assertTrue(prompt.contains(workDir.toAbsolutePath().toString()));
        assertTrue(prompt.contains("- explorer: Explores code"));
        assertTrue(prompt.contains("file pom.xml"));
        assertTrue(prompt.contains("dir  src"));
        assertTrue(prompt.contains("### run_command"));
    }

    @Test
    void testToolSectionFollowsWhitelist() {
        String section = PromptRenderer.renderToolSection(registry(new ToolFilter("reviewer", Set.of("read_file"))));

        assertTrue(section.contains("### read_file"));
        assertFalse(section.contains("### propose_edit"));
    }

    @Test
    void testDescribeAgentsWhenEmpty() {
        assertEquals("(no sub-agents available)", PromptRenderer.describeAgents(List.of()));
    }
}
