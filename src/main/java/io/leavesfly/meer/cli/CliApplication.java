package io.leavesfly.meer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.leavesfly.meer.MeerFactory;
import io.leavesfly.meer.SessionOptions;
import io.leavesfly.meer.command.CommandRegistry;
import io.leavesfly.meer.config.ShellUIConfig;
import io.leavesfly.meer.engine.MeerEngine;
import io.leavesfly.meer.engine.TurnResult;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.ui.shell.Console;
import io.leavesfly.meer.ui.shell.ShellUI;
import io.leavesfly.meer.ui.shell.WireRenderer;
import io.leavesfly.meer.wire.Wire;
import io.leavesfly.meer.wire.WireImpl;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import reactor.core.Disposable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * CLI 应用入口
 * 使用 Picocli 实现命令行参数解析
 * <p>
 * 不带子命令时启动交互式 Shell，或用 -c 执行单条指令；
 * agents / delegate / parallel 子命令直接操作注册表和编排器。
 */
@Slf4j
@Component
@Command(
        name = "meer",
        description = "Coding assistant that delegates focused tasks to sub-agents",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {AgentsCommand.class, DelegateCommand.class, ParallelCommand.class}
)
public class CliApplication implements CommandLineRunner, Runnable {

    private final MeerFactory factory;
    private final CommandRegistry commandRegistry;
    private final ShellUIConfig shellUIConfig;

    public CliApplication(MeerFactory factory, CommandRegistry commandRegistry, ShellUIConfig shellUIConfig) {
        this.factory = factory;
        this.commandRegistry = commandRegistry;
        this.shellUIConfig = shellUIConfig;
    }

    @Option(names = {"--verbose"}, description = "Log debug information", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-w", "--work-dir"}, description = "Working directory for the agents",
            scope = CommandLine.ScopeType.INHERIT)
    private Path workDir = Paths.get(System.getProperty("user.dir"));

    @Option(names = {"-m", "--model"}, description = "LLM model to use", scope = CommandLine.ScopeType.INHERIT)
    private String modelName;

    @Option(names = {"-y", "--yolo", "--yes"}, description = "Apply all edits and allow all commands without asking",
            scope = CommandLine.ScopeType.INHERIT)
    private boolean yolo;

    @Option(names = {"--dry-run"}, description = "Show proposed edits without writing them",
            scope = CommandLine.ScopeType.INHERIT)
    private boolean dryRun;

    @Option(names = {"--max-iterations"}, description = "Maximum tool-loop iterations per run",
            scope = CommandLine.ScopeType.INHERIT)
    private Integer maxIterations;

    @Option(names = {"-c", "--command"}, description = "Run a single request and exit")
    private String command;

    @Override
    public void run(String... args) throws Exception {
        CommandLine commandLine = new CommandLine(this);
        int exitCode = commandLine.execute(args);

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * 不带子命令时由 Picocli 调用
     */
    @Override
    public void run() {
        applyVerbosity();
        try (Console console = Console.open(commandRegistry)) {
            Wire wire = new WireImpl();
            MeerEngine engine = factory.createEngine(buildOptions(), console.getApprover(), console.getApprover(), wire);

            if (command != null && !command.isBlank()) {
                runSingle(engine, console);
                return;
            }

            try (ShellUI shellUI = new ShellUI(engine, console, commandRegistry,
                    shellUIConfig.isShowSubagentSteps())) {
                shellUI.run();
            }
        } catch (MeerException e) {
            log.error("Failed to start Meer", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Error executing Meer", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    private void runSingle(MeerEngine engine, Console console) {
        WireRenderer renderer = new WireRenderer(console.getTerminal(), console.getOutputFormatter(),
                shellUIConfig.isShowSubagentSteps());
        Disposable subscription = engine.getWire().asFlux().subscribe(renderer::render);
        try {
            TurnResult result = engine.run(command).block();
            renderer.finishTurn("ready");
            if (result == null) {
                return;
            }
            ShellUI.printReview(console.getOutputFormatter(), result.getLoopResult().getReviewEntries());
            if (result.hasNotice()) {
                console.getOutputFormatter().printError(result.getNotice());
                System.exit(1);
            }
        } finally {
            subscription.dispose();
        }
    }

    SessionOptions buildOptions() {
        return SessionOptions.builder()
                .workDir(getWorkDir())
                .modelName(modelName)
                .maxIterations(maxIterations)
                .yolo(yolo)
                .dryRun(dryRun)
                .build();
    }

    void applyVerbosity() {
        if (verbose) {
            Logger logger = (Logger) LoggerFactory.getLogger("io.leavesfly.meer");
            logger.setLevel(Level.DEBUG);
            log.debug("Verbose logging enabled");
        }
    }

    public MeerFactory getFactory() {
        return factory;
    }

    public Path getWorkDir() {
        return workDir.toAbsolutePath().normalize();
    }

    public CommandRegistry getCommandRegistry() {
        return commandRegistry;
    }

    public ShellUIConfig getShellUIConfig() {
        return shellUIConfig;
    }
}
