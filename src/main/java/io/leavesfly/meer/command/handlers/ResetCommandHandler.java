package io.leavesfly.meer.command.handlers;

import io.leavesfly.meer.command.CommandContext;
import io.leavesfly.meer.command.CommandHandler;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * /reset 命令处理器
 */
@Component
public class ResetCommandHandler implements CommandHandler {

    @Override
    public String getName() {
        return "reset";
    }

    @Override
    public String getDescription() {
        return "清除对话历史";
    }

    @Override
    public List<String> getAliases() {
        return List.of("clear");
    }

    @Override
    public void execute(CommandContext context) {
        context.getEngine().reset();
        context.getOutputFormatter().printSuccess("✓ Conversation history cleared");
    }
}
