package io.leavesfly.meer.cli;

import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.orchestrator.DelegationOptions;
import io.leavesfly.meer.ui.shell.Console;
import io.leavesfly.meer.ui.shell.ShellUI;
import io.leavesfly.meer.ui.shell.WireRenderer;
import io.leavesfly.meer.wire.Wire;
import io.leavesfly.meer.wire.WireImpl;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import reactor.core.Disposable;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * delegate 子命令：不经过主代理，直接运行一个子代理
 */
@Slf4j
@Command(
        name = "delegate",
        description = "Run a single task on a sub-agent",
        mixinStandardHelpOptions = true
)
public class DelegateCommand implements Callable<Integer> {

    @ParentCommand
    private CliApplication parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<agent>", description = "Agent name")
    private String agentName;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "<task>", description = "Task description")
    private List<String> taskWords;

    @Option(names = {"-t", "--timeout"}, description = "Timeout in seconds")
    private Integer timeoutSeconds;

    @Override
    public Integer call() throws Exception {
        parent.applyVerbosity();
        PrintWriter err = spec.commandLine().getErr();

        try (Console console = Console.open(null)) {
            Wire wire = new WireImpl();
            AgentOrchestrator orchestrator = parent.getFactory()
                    .createOrchestrator(parent.buildOptions(), console.getApprover(), console.getApprover(), wire);
            WireRenderer renderer = new WireRenderer(console.getTerminal(), console.getOutputFormatter(), true);
            Disposable subscription = wire.asFlux().subscribe(renderer::render);

            SubAgentResult result;
            try {
                result = orchestrator.delegateTask(agentName, String.join(" ", taskWords), options()).block();
            } finally {
                renderer.finishTurn("ready");
                subscription.dispose();
            }
            if (result == null) {
                return 1;
            }

            PrintWriter out = console.getTerminal().writer();
            if (result.isSuccess()) {
                out.println(result.getOutput());
                result.getMetadata().getErrors().forEach(error -> console.getOutputFormatter().printWarning(error));
            } else {
                console.getOutputFormatter().printError("Sub-agent " + agentName + " failed: " + result.getError());
            }
            ShellUI.printReview(console.getOutputFormatter(), result.getEditReview());
            out.flush();
            return result.isSuccess() ? 0 : 1;
        } catch (MeerException e) {
            log.warn("Delegation to {} rejected: {}", agentName, e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private DelegationOptions options() {
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            return DelegationOptions.withTimeout(timeoutSeconds * 1000L);
        }
        return DelegationOptions.defaults();
    }
}
