package io.leavesfly.meer.ui.shell;

import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import io.leavesfly.meer.command.CommandRegistry;
import io.leavesfly.meer.engine.MeerEngine;
import io.leavesfly.meer.engine.TurnResult;
import io.leavesfly.meer.engine.approval.EditDisposition;
import io.leavesfly.meer.engine.approval.EditReviewEntry;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import reactor.core.Disposable;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shell UI - 基于 JLine 的交互式命令行界面
 * <p>
 * 以 / 开头的输入交给 CommandRegistry，其余输入作为一轮对话交给主代理。
 */
@Slf4j
public class ShellUI implements AutoCloseable {

    private final MeerEngine engine;
    private final Console console;
    private final CommandRegistry commandRegistry;
    private final WireRenderer renderer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Disposable wireSubscription;

    public ShellUI(MeerEngine engine, Console console, CommandRegistry commandRegistry, boolean showSubagentSteps) {
        this.engine = engine;
        this.console = console;
        this.commandRegistry = commandRegistry;
        this.renderer = new WireRenderer(console.getTerminal(), console.getOutputFormatter(), showSubagentSteps);
        if (engine.getWire() != null) {
            this.wireSubscription = engine.getWire().asFlux().subscribe(renderer::render);
        }
        log.info("Shell started with {} meta commands", commandRegistry.size());
    }

    /**
     * 运行主循环，直到 exit / quit 或 EOF
     */
    public void run() {
        running.set(true);
        printWelcome();

        while (running.get()) {
            try {
                String input = console.getLineReader().readLine(buildPrompt());
                if (input == null) {
                    break;
                }
                if (!processInput(input.trim())) {
                    break;
                }
            } catch (UserInterruptException e) {
                out().printInfo("Tip: press Ctrl-D or type 'exit' to quit");
            } catch (EndOfFileException e) {
                break;
            } catch (Exception e) {
                log.error("Error in shell UI", e);
                out().printError("Error: " + e.getMessage());
            }
        }
        out().printInfo("Bye!");
    }

    public void stop() {
        running.set(false);
    }

    boolean processInput(String input) {
        if (input.isEmpty()) {
            return true;
        }
        if (input.equals("exit") || input.equals("quit")) {
            return false;
        }
        if (input.startsWith("/")) {
            return dispatchCommand(input);
        }
        runTurn(input);
        return true;
    }

    private boolean dispatchCommand(String input) {
        String[] parts = input.substring(1).trim().split("\\s+");
        String name = parts[0];
        if (name.equals("exit") || name.equals("quit")) {
            return false;
        }

        Optional<CommandHandler> handler = commandRegistry.find(name);
        if (handler.isEmpty()) {
            out().printError("Unknown command: /" + name + " (type /help for a list)");
            return true;
        }

        CommandContext context = CommandContext.builder()
                .engine(engine)
                .terminal(console.getTerminal())
                .rawInput(input)
                .commandName(name)
                .args(Arrays.copyOfRange(parts, 1, parts.length))
                .outputFormatter(out())
                .build();
        try {
            handler.get().execute(context);
        } catch (Exception e) {
            log.error("Command /{} failed", name, e);
            out().printError("Command failed: " + e.getMessage());
        }
        return true;
    }

    private void runTurn(String input) {
        TurnResult result = engine.run(input).block();
        renderer.finishTurn("ready");
        if (result == null) {
            return;
        }
        printReview(out(), result.getLoopResult().getReviewEntries());
        if (result.hasNotice()) {
            renderer.finishTurn("error");
            out().printError(result.getNotice());
        }
    }

    /**
     * 打印编辑审核结果
     */
    public static void printReview(OutputFormatter out, List<EditReviewEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        out.println();
        for (EditReviewEntry entry : entries) {
            if (entry.getDisposition() == EditDisposition.APPLIED) {
                out.printSuccess("✓ " + entry);
            } else if (entry.getDisposition() == EditDisposition.FAILED) {
                out.printError("✗ " + entry);
            } else {
                out.printStatus("- " + entry);
            }
        }
    }

    private String buildPrompt() {
        AttributedStyle style;
        String icon;
        switch (renderer.getCurrentStatus()) {
            case "interrupted":
            case "error":
                style = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
                icon = "❌";
                break;
            default:
                style = AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);
                icon = "✨";
        }
        return new AttributedString(icon + " meer> ", style).toAnsi();
    }

    private void printWelcome() {
        Terminal terminal = console.getTerminal();
        String banner = """
                ╔═══════════════════════════════════════╗
                ║                                       ║
                ║     _ __ ___   ___  ___ _ __          ║
                ║    | '_ ` _ \\ / _ \\/ _ \\ '__|         ║
                ║    | | | | | |  __/  __/ |            ║
                ║    |_| |_| |_|\\___|\\___|_|            ║
                ║                                       ║
                ╚═══════════════════════════════════════╝
                """;
        terminal.writer().println(new AttributedString(banner,
                AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold()).toAnsi());
        out().printSuccess("Welcome to Meer (model: " + engine.getModel() + ")");
        out().printInfo("Type /help for available commands, or just start chatting!");
        out().println();
    }

    private OutputFormatter out() {
        return console.getOutputFormatter();
    }

    @Override
    public void close() {
        if (wireSubscription != null) {
            wireSubscription.dispose();
        }
    }
}
