package io.leavesfly.meer.ui.shell;

import io.leavesfly.meer.engine.approval.EditApprover;
import io.leavesfly.meer.engine.approval.EditDecision;
import io.leavesfly.meer.engine.approval.ProposedEdit;
import io.leavesfly.meer.tool.bash.CommandConfirmation;
import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

import java.util.List;
import java.util.Locale;

/**
 * 终端交互式审批
 * 逐个展示编辑的 diff 并读取决定；执行 shell 命令前同样征求确认
 * <p>
 * 多个子代理可能同时结束，提示与读取在同一把锁内完成。
 */
@Slf4j
public class ConsoleEditApprover implements EditApprover, CommandConfirmation {

    private final LineReader lineReader;
    private final OutputFormatter out;

    public ConsoleEditApprover(LineReader lineReader, OutputFormatter out) {
        this.lineReader = lineReader;
        this.out = out;
    }

    @Override
    public synchronized EditDecision decide(ProposedEdit edit, List<String> diffLines, int index, int total) {
        out.println();
        out.printStatus(String.format("📝 Edit %d/%d: %s%s", index, total, edit.getPath(),
                edit.isNewFile() ? " (new file)" : ""));
        if (edit.getDescription() != null && !edit.getDescription().isBlank()) {
            out.printInfo("  " + edit.getDescription());
        }
        diffLines.forEach(out::printDiffLine);
        out.println();

        String answer = ask("❓ Apply this edit? [y]es / [n]o / [a]ll / [s]kip all: ");
        switch (answer) {
            case "y":
            case "yes":
                return EditDecision.APPLY;
            case "a":
            case "all":
                return EditDecision.APPLY_ALL;
            case "s":
            case "skip all":
                return EditDecision.SKIP_ALL;
            default:
                return EditDecision.SKIP;
        }
    }

    @Override
    public synchronized boolean confirm(String command) {
        out.println();
        out.printStatus("⚠️  Run command: " + command);
        String answer = ask("❓ Allow? [y/n]: ");
        return "y".equals(answer) || "yes".equals(answer);
    }

    private String ask(String prompt) {
        String styled = new AttributedString(prompt,
                AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold()).toAnsi();
        try {
            String line = lineReader.readLine(styled);
            return line == null ? "" : line.trim().toLowerCase(Locale.ROOT);
        } catch (UserInterruptException | EndOfFileException e) {
            log.info("Prompt interrupted, treating as rejection");
            out.printError("❌ Cancelled");
            return "";
        }
    }
}
