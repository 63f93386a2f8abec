package io.leavesfly.meer.ui.shell.output;

import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/**
 * 终端输出格式化器
 * 按消息类型使用不同颜色输出
 */
public class OutputFormatter {

    private final Terminal terminal;

    public OutputFormatter(Terminal terminal) {
        this.terminal = terminal;
    }

    public void println() {
        println("");
    }

    public void println(String text) {
        terminal.writer().println(text);
        terminal.flush();
    }

    public void printSuccess(String text) {
        printStyled(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN));
    }

    public void printInfo(String text) {
        printStyled(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.BLUE));
    }

    public void printStatus(String text) {
        printStyled(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW));
    }

    public void printWarning(String text) {
        printStyled(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold());
    }

    public void printError(String text) {
        printStyled(text, AttributedStyle.DEFAULT.foreground(AttributedStyle.RED));
    }

    /**
     * 输出一行 diff，按行首符号着色
     */
    public void printDiffLine(String line) {
        if (line.startsWith("+") && !line.startsWith("+++")) {
            printStyled(line, AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN));
        } else if (line.startsWith("-") && !line.startsWith("---")) {
            printStyled(line, AttributedStyle.DEFAULT.foreground(AttributedStyle.RED));
        } else if (line.startsWith("@@")) {
            printStyled(line, AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN));
        } else {
            println(line);
        }
    }

    private void printStyled(String text, AttributedStyle style) {
        terminal.writer().println(new AttributedString(text, style).toAnsi());
        terminal.flush();
    }

    public Terminal getTerminal() {
        return terminal;
    }
}
