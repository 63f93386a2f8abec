package io.leavesfly.meer.command;

import java.util.Collections;
import java.util.List;

/**
 * Shell 元命令处理器
 * 实现类注册为 Spring Bean 后由 CommandRegistry 自动收集
 */
public interface CommandHandler {

    /**
     * 命令名称（不含 / 前缀）
     */
    String getName();

    String getDescription();

    default String getUsage() {
        return "/" + getName();
    }

    default List<String> getAliases() {
        return Collections.emptyList();
    }

    void execute(CommandContext context) throws Exception;
}
