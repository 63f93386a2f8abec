package io.leavesfly.meer.ui.shell;

import io.leavesfly.meer.command.CommandRegistry;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import lombok.Getter;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.IOException;

/**
 * 终端资源：Terminal、LineReader、输出格式化器和交互式审批
 */
@Getter
public class Console implements AutoCloseable {

    private final Terminal terminal;
    private final LineReader lineReader;
    private final OutputFormatter outputFormatter;
    private final ConsoleEditApprover approver;

    private Console(Terminal terminal, LineReader lineReader) {
        this.terminal = terminal;
        this.lineReader = lineReader;
        this.outputFormatter = new OutputFormatter(terminal);
        this.approver = new ConsoleEditApprover(lineReader, outputFormatter);
    }

    /**
     * @param commandRegistry 用于补全元命令，可为 null
     * @throws IOException 终端初始化失败
     */
    public static Console open(CommandRegistry commandRegistry) throws IOException {
        Terminal terminal = TerminalBuilder.builder()
                .system(true)
                .encoding("UTF-8")
                .build();

        LineReaderBuilder builder = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("Meer")
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .option(LineReader.Option.AUTO_LIST, true)
                .option(LineReader.Option.CASE_INSENSITIVE, true);
        if (commandRegistry != null) {
            builder.completer(new StringsCompleter(commandRegistry.getCompletionCandidates()));
        }
        return new Console(terminal, builder.build());
    }

    @Override
    public void close() throws IOException {
        terminal.close();
    }
}
