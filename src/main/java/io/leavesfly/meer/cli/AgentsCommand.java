package io.leavesfly.meer.cli;

import io.leavesfly.meer.agent.AgentDefinition;
import io.leavesfly.meer.agent.AgentDiscoveryResult;
import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.agent.AgentScope;
import io.leavesfly.meer.exception.MeerException;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * agents 子命令：管理子代理定义
 * <p>
 * 既作为 `meer agents` 使用，也被 Shell 的 /agents 复用。
 */
@Slf4j
@Command(
        name = "agents",
        description = "Manage sub-agent definitions",
        mixinStandardHelpOptions = true
)
public class AgentsCommand implements Callable<Integer> {

    @ParentCommand
    private CliApplication parent;

    @Spec
    private CommandSpec spec;

    private AgentRegistry registry;

    public AgentsCommand() {
    }

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        return list(false);
    }

    @Command(name = "list", description = "List agents from all scopes")
    public int list(@Option(names = "--enabled-only", description = "Only show enabled agents") boolean enabledOnly) {
        List<AgentDiscoveryResult> agents = enabledOnly ? registry().getEnabledAgents() : registry().getAllAgents();
        if (agents.isEmpty()) {
            out().println("No agents found.");
            return 0;
        }
        agents.sort(Comparator.comparing(result -> result.getDefinition().getName()));
        out().println("Available agents:");
        for (AgentDiscoveryResult result : agents) {
            printSummaryLine(result);
        }
        out().println();
        out().println("Total: " + agents.size());
        return 0;
    }

    @Command(name = "show", description = "Show an agent definition")
    public int show(@Parameters(paramLabel = "<name>") String name) {
        Optional<AgentDiscoveryResult> found = registry().getAgentResult(name);
        if (found.isEmpty()) {
            err().println("Agent not found: " + name);
            return 1;
        }
        AgentDiscoveryResult result = found.get();
        AgentDefinition definition = result.getDefinition();
        PrintWriter out = out();
        out.println("Name:        " + definition.getName());
        out.println("Description: " + definition.getDescription());
        out.println("Model:       " + definition.getModel());
        out.println("Enabled:     " + definition.isEnabled());
        out.println("Tools:       " + (definition.getAllowedTools() == null
                ? "(all)" : String.join(", ", definition.getAllowedTools())));
        if (definition.getMaxIterations() != null) {
            out.println("Max iter.:   " + definition.getMaxIterations());
        }
        if (definition.getTemperature() != null) {
            out.println("Temperature: " + definition.getTemperature());
        }
        if (definition.getTags() != null && !definition.getTags().isEmpty()) {
            out.println("Tags:        " + String.join(", ", definition.getTags()));
        }
        if (definition.getVersion() != null) {
            out.println("Version:     " + definition.getVersion());
        }
        if (definition.getAuthor() != null) {
            out.println("Author:      " + definition.getAuthor());
        }
        out.println("Scope:       " + result.getScope());
        out.println("File:        " + result.getSourcePath());
        out.println();
        out.println(definition.getSystemPrompt());
        return 0;
    }

    @Command(name = "search", description = "Search agents by name, description or tag")
    public int search(@Parameters(paramLabel = "<query>") String query) {
        List<AgentDiscoveryResult> matches = registry().searchAgents(query);
        if (matches.isEmpty()) {
            out().println("No agents match \"" + query + "\".");
            return 0;
        }
        matches.forEach(this::printSummaryLine);
        return 0;
    }

    @Command(name = "create", description = "Create an agent definition file")
    public int create(
            @Option(names = "--name", required = true, description = "Agent name (lowercase, digits, hyphens)") String name,
            @Option(names = "--description", required = true, description = "One-line description") String description,
            @Option(names = "--tools", split = ",", description = "Allowed tools, comma separated") List<String> tools,
            @Option(names = "--tags", split = ",", description = "Tags, comma separated") List<String> tags,
            @Option(names = "--model", defaultValue = AgentDefinition.INHERIT_MODEL, description = "Model name or inherit") String model,
            @Option(names = "--prompt", description = "System prompt") String prompt,
            @Option(names = "--scope", defaultValue = "project", description = "project or user") String scope) {
        AgentDefinition definition = AgentDefinition.builder()
                .name(name)
                .description(description)
                .model(model)
                .allowedTools(tools == null ? null : new LinkedHashSet<>(tools))
                .tags(tags == null ? null : new LinkedHashSet<>(tags))
                .systemPrompt(prompt != null ? prompt : defaultPrompt(name, description))
                .build();
        try {
            Path file = registry().saveAgent(definition, AgentScope.fromValue(scope));
            out().println("Created agent " + name + " at " + file);
            return 0;
        } catch (IllegalArgumentException | MeerException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "enable", description = "Enable an agent")
    public int enable(@Parameters(paramLabel = "<name>") String name) {
        return toggle(name, true);
    }

    @Command(name = "disable", description = "Disable an agent")
    public int disable(@Parameters(paramLabel = "<name>") String name) {
        return toggle(name, false);
    }

    @Command(name = "delete", description = "Delete an agent definition file")
    public int delete(
            @Parameters(paramLabel = "<name>") String name,
            @Option(names = "--scope", defaultValue = "project", description = "project or user") String scope) {
        try {
            registry().deleteAgent(name, AgentScope.fromValue(scope));
            out().println("Deleted agent " + name + " from " + scope + " scope");
            return 0;
        } catch (IllegalArgumentException | MeerException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int toggle(String name, boolean enabled) {
        try {
            Path file = registry().setEnabled(name, enabled);
            out().println((enabled ? "Enabled " : "Disabled ") + name + " (" + file + ")");
            return 0;
        } catch (IllegalArgumentException | MeerException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void printSummaryLine(AgentDiscoveryResult result) {
        AgentDefinition definition = result.getDefinition();
        out().println(String.format("  %s %-20s [%s] %s",
                definition.isEnabled() ? "•" : "○",
                definition.getName(),
                result.getScope(),
                definition.getDescription()));
    }

    static String defaultPrompt(String name, String description) {
        return "You are " + name + ", a specialized sub-agent. " + description;
    }

    private AgentRegistry registry() {
        if (registry == null) {
            registry = parent.getFactory().registryFor(parent.getWorkDir());
        }
        return registry;
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
