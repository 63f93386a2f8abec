package io.leavesfly.meer.tool.bash;

/**
 * 执行 shell 命令前的确认
 */
@FunctionalInterface
public interface CommandConfirmation {

    /**
     * @return true 表示允许执行
     */
    boolean confirm(String command);

    static CommandConfirmation always() {
        return command -> true;
    }

    static CommandConfirmation never() {
        return command -> false;
    }
}
