package io.leavesfly.meer.command.handlers;

import io.leavesfly.meer.cli.AgentsCommand;
import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * /agents 命令处理器
 * <p>
 * 复用 agents 子命令的解析和输出，注册表取自当前主代理的编排器。
 */
@Component
public class AgentsCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "agents";
    }

    @Override
    public String getDescription() {
        return "管理子代理定义";
    }

    @Override
    public String getUsage() {
        return "/agents [list|show|search|create|enable|disable|delete] ...";
    }

    @Override
    public void execute(CommandContext context) {
        PrintWriter writer = context.getTerminal().writer();
        CommandLine commandLine = new CommandLine(
                new AgentsCommand(context.getEngine().getOrchestrator().getRegistry()));
        commandLine.setOut(writer);
        commandLine.setErr(writer);
        int exitCode = commandLine.execute(context.getArgs());
        writer.flush();
        if (exitCode != 0) {
            context.getOutputFormatter().printWarning("Usage: " + getUsage());
        }
    }
}
