package io.leavesfly.meer.command.handlers;

import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import io.leavesfly.meer.engine.subagent.SubAgentStatusInfo;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * /status 命令处理器
 * 显示主代理状态和正在运行的子代理
 */
@Component
public class StatusCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "status";
    }

    @Override
    public String getDescription() {
        return "显示当前状态";
    }

    @Override
    public void execute(CommandContext context) {
        OutputFormatter out = context.getOutputFormatter();
        Map<String, Object> status = context.getEngine().getStatus();

        out.println();
        out.printSuccess("Session:");
        status.forEach((key, value) -> out.println(String.format("  %-16s %s", key + ":", value)));

        List<SubAgentStatusInfo> active = context.getEngine().getOrchestrator().getAllActiveAgents();
        if (!active.isEmpty()) {
            out.println();
            out.printSuccess("Running sub-agents:");
            for (SubAgentStatusInfo info : active) {
                out.println(String.format("  %s [%s] %s %d%% (%ds)", info.getId(), info.getAgentName(),
                        info.getStatus(), info.getProgress(), info.getElapsedMs() / 1000));
            }
        }
        out.println();
    }
}
