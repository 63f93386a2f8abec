package io.leavesfly.meer.cli;

import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.orchestrator.DelegationOptions;
import io.leavesfly.meer.orchestrator.ParallelTask;
import io.leavesfly.meer.ui.shell.Console;
import io.leavesfly.meer.ui.shell.WireRenderer;
import io.leavesfly.meer.wire.Wire;
import io.leavesfly.meer.wire.WireImpl;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import reactor.core.Disposable;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * parallel 子命令：并行运行多个子代理并输出汇总报告
 */
@Slf4j
@Command(
        name = "parallel",
        description = "Run several sub-agent tasks concurrently and print an aggregate report",
        mixinStandardHelpOptions = true
)
public class ParallelCommand implements Callable<Integer> {

    @ParentCommand
    private CliApplication parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-t", "--task"}, required = true, paramLabel = "<agent=task>",
            description = "Task in the form agent=description; repeat for more tasks")
    private List<String> taskSpecs;

    @Option(names = {"--timeout"}, description = "Per-task timeout in seconds")
    private Integer timeoutSeconds;

    @Override
    public Integer call() throws Exception {
        parent.applyVerbosity();
        PrintWriter err = spec.commandLine().getErr();
        List<ParallelTask> tasks;
        try {
            tasks = parseTasks(taskSpecs, options());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }

        try (Console console = Console.open(null)) {
            Wire wire = new WireImpl();
            AgentOrchestrator orchestrator = parent.getFactory()
                    .createOrchestrator(parent.buildOptions(), console.getApprover(), console.getApprover(), wire);
            WireRenderer renderer = new WireRenderer(console.getTerminal(), console.getOutputFormatter(),
                    parent.getShellUIConfig().isShowSubagentSteps());
            Disposable subscription = wire.asFlux().subscribe(renderer::render);

            List<SubAgentResult> results;
            try {
                results = orchestrator.delegateParallel(tasks).block();
            } finally {
                renderer.finishTurn("ready");
                subscription.dispose();
            }
            if (results == null) {
                return 1;
            }

            PrintWriter out = console.getTerminal().writer();
            out.println(orchestrator.aggregateResults(results));
            out.flush();
            return results.stream().allMatch(SubAgentResult::isSuccess) ? 0 : 1;
        } catch (MeerException e) {
            log.warn("Parallel delegation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 解析 agent=task 形式的任务
     *
     * @throws IllegalArgumentException 缺少分隔符、代理名或任务描述
     */
    static List<ParallelTask> parseTasks(List<String> specs, DelegationOptions options) {
        List<ParallelTask> tasks = new ArrayList<>();
        for (String taskSpec : specs) {
            int separator = taskSpec.indexOf('=');
            if (separator <= 0 || separator == taskSpec.length() - 1) {
                throw new IllegalArgumentException("Invalid task '" + taskSpec + "', expected agent=description");
            }
            tasks.add(new ParallelTask(taskSpec.substring(0, separator).trim(),
                    taskSpec.substring(separator + 1).trim(), options));
        }
        return tasks;
    }

    private DelegationOptions options() {
        if (timeoutSeconds != null && timeoutSeconds > 0) {
            return DelegationOptions.withTimeout(timeoutSeconds * 1000L);
        }
        return DelegationOptions.defaults();
    }
}
