package io.leavesfly.meer.command;

import io.leavesfly.meer.engine.MeerEngine;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import lombok.Builder;
import lombok.Getter;
import org.jline.terminal.Terminal;

/**
 * 元命令执行上下文
 * <p>
 * 由 ShellUI 在每次输入 /xxx 时构建，参数按空白切分。
 */
@Getter
@Builder
public class CommandContext {

    private final MeerEngine engine;

    private final Terminal terminal;

    /**
     * 原始输入字符串
     */
    private final String rawInput;

    /**
     * 命令名称（不含 / 前缀）
     */
    private final String commandName;

    private final String[] args;

    private final OutputFormatter outputFormatter;

    /**
     * @return 参数字符串，没有参数时返回空字符串
     */
    public String getArgsAsString() {
        if (args == null || args.length == 0) {
            return "";
        }
        return String.join(" ", args);
    }

    /**
     * @return 参数值，索引越界时返回 null
     */
    public String getArg(int index) {
        if (args == null || index < 0 || index >= args.length) {
            return null;
        }
        return args[index];
    }

    public int getArgCount() {
        return args == null ? 0 : args.length;
    }
}
