package io.leavesfly.meer.command.handlers;

import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import io.leavesfly.meer.engine.subagent.SubAgentResult;
import io.leavesfly.meer.exception.MeerException;
import io.leavesfly.meer.orchestrator.AgentOrchestrator;
import io.leavesfly.meer.ui.shell.ShellUI;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * /delegate 命令处理器
 * 绕过主代理，直接把任务交给指定子代理
 */
@Slf4j
@Component
public class DelegateCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "delegate";
    }

    @Override
    public String getDescription() {
        return "直接委托任务给子代理";
    }

    @Override
    public String getUsage() {
        return "/delegate <agent> <task>";
    }

    @Override
    public List<String> getAliases() {
        return List.of("d");
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        if (context.getArgCount() < 2) {
            out.printError("Usage: " + getUsage());
            return;
        }

        String agentName = context.getArg(0);
        String task = String.join(" ", Arrays.copyOfRange(context.getArgs(), 1, context.getArgCount()));
        AgentOrchestrator orchestrator = context.getEngine().getOrchestrator();

        SubAgentResult result;
        try {
            out.printStatus("Delegating to " + agentName + "...");
            result = orchestrator.delegateTask(agentName, task).block();
        } catch (MeerException e) {
            out.printError(e.getMessage());
            return;
        }
        if (result == null) {
            return;
        }

        out.println();
        if (result.isSuccess()) {
            out.printSuccess("✓ " + agentName + " finished in " + result.getMetadata().getDurationMs() + "ms");
            out.println(result.getOutput());
            result.getMetadata().getErrors().forEach(out::printWarning);
        } else {
            out.printError("✗ " + agentName + " failed: " + result.getError());
        }
        ShellUI.printReview(out, result.getEditReview());
    }
}
