package io.leavesfly.meer.command.handlers;

import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import io.leavesfly.meer.command.CommandRegistry;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * /help 命令处理器
 * 显示帮助信息
 */
@Component
public class HelpCommandHandler implements CommandHandler {

    private final CommandRegistry commandRegistry;

    public HelpCommandHandler(@Lazy CommandRegistry commandRegistry) {
        this.commandRegistry = commandRegistry;
    }

    @Override
    public String getName() {
        return "help";
    }

    @Override
    public String getDescription() {
        return "显示帮助信息";
    }

    @Override
    public List<String> getAliases() {
        return List.of("h", "?");
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();

        out.println();
        out.println("┌────────────────────────────────────────────────────────────┐");
        out.println("│                     Meer CLI Help                          │");
        out.println("└────────────────────────────────────────────────────────────┘");
        out.println();

        out.printSuccess("基本命令:");
        out.println("  exit, quit      - 退出 Meer");
        out.println();

        out.printSuccess("元命令 (Meta Commands):");
        commandRegistry.getHandlers().stream()
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(handler -> out.println(String.format("  %-28s - %s",
                        formatNames(handler), handler.getDescription())));
        out.println();

        out.printInfo("或者直接输入你的问题，主代理会自行决定是否委托给子代理。");
        out.println();
    }

    private static String formatNames(CommandHandler handler) {
        String names = "/" + handler.getName();
        if (!handler.getAliases().isEmpty()) {
            names += handler.getAliases().stream()
                    .map(alias -> ", /" + alias)
                    .collect(Collectors.joining());
        }
        return names;
    }
}
