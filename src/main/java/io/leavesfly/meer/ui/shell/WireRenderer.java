package io.leavesfly.meer.ui.shell;

import io.leavesfly.meer.ui.shell.output.OutputFormatter;
import io.leavesfly.meer.wire.message.AssistantTextDelta;
import io.leavesfly.meer.wire.message.StepBegin;
import io.leavesfly.meer.wire.message.StepInterrupted;
import io.leavesfly.meer.wire.message.ToolCallBegin;
import io.leavesfly.meer.wire.message.ToolCallEnd;
import io.leavesfly.meer.wire.message.WireMessage;
import lombok.extern.slf4j.Slf4j;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * 把 Wire 消息渲染到终端
 * <p>
 * 主代理的文本流式输出；子代理只显示步骤和工具调用，以名称前缀区分。
 */
@Slf4j
public class WireRenderer {

    private static final int MAX_PARAM_PREVIEW = 60;

    private final Terminal terminal;
    private final OutputFormatter out;
    private final boolean showSubagentSteps;

    private final AtomicBoolean assistantOutputStarted = new AtomicBoolean(false);
    private final AtomicInteger currentLineLength = new AtomicInteger(0);
    private final AtomicReference<String> currentStatus = new AtomicReference<>("ready");

    public WireRenderer(Terminal terminal, OutputFormatter out, boolean showSubagentSteps) {
        this.terminal = terminal;
        this.out = out;
        this.showSubagentSteps = showSubagentSteps;
    }

    public void render(WireMessage message) {
        try {
            if (message instanceof StepBegin stepBegin) {
                if (stepBegin.isSubagent()) {
                    if (showSubagentSteps) {
                        endAssistantLine();
                        out.printStatus("  🤖 [" + stepBegin.getAgentName() + "] Step "
                                + stepBegin.getStepNumber() + " - Thinking...");
                    }
                } else {
                    currentStatus.set("thinking");
                    endAssistantLine();
                    out.printStatus("🤔 Step " + stepBegin.getStepNumber() + " - Thinking...");
                }
            } else if (message instanceof AssistantTextDelta delta) {
                if (!delta.isSubagent()) {
                    printAssistantText(delta.getText());
                }
            } else if (message instanceof ToolCallBegin begin) {
                if (begin.isSubagent() && !showSubagentSteps) {
                    return;
                }
                endAssistantLine();
                String prefix = begin.isSubagent() ? "  🔧 [" + begin.getAgentName() + "] " : "🔧 ";
                out.printInfo(prefix + begin.getToolName() + formatParams(begin.getParams()));
            } else if (message instanceof ToolCallEnd end) {
                if (end.isSubagent() && !showSubagentSteps) {
                    return;
                }
                String prefix = end.isSubagent() ? "     " : "   ";
                if (end.isError()) {
                    out.printError(prefix + "✗ " + nullToEmpty(end.getBrief()));
                } else {
                    out.printSuccess(prefix + "✓ " + nullToEmpty(end.getBrief()));
                }
            } else if (message instanceof StepInterrupted interrupted) {
                currentStatus.set("interrupted");
                endAssistantLine();
                String who = interrupted.isSubagent() ? "[" + interrupted.getAgentName() + "] " : "";
                out.printError("⚠️  " + who + "Step interrupted: " + interrupted.getReason());
            }
        } catch (Exception e) {
            log.error("Error rendering wire message", e);
        }
    }

    /**
     * 一轮结束后调用，补齐换行并重置状态
     */
    public void finishTurn(String status) {
        endAssistantLine();
        currentStatus.set(status);
    }

    public String getCurrentStatus() {
        return currentStatus.get();
    }

    private void printAssistantText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (!assistantOutputStarted.getAndSet(true)) {
            terminal.writer().println();
            currentLineLength.set(0);
        }

        int terminalWidth = terminal.getWidth();
        int maxLineWidth = terminalWidth > 20 ? terminalWidth - 4 : 76;
        AttributedStyle style = AttributedStyle.DEFAULT.foreground(AttributedStyle.WHITE);

        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n') {
                terminal.writer().println();
                currentLineLength.set(0);
                continue;
            }
            int charWidth = isWideChar(ch) ? 2 : 1;
            if (currentLineLength.get() + charWidth > maxLineWidth) {
                terminal.writer().println();
                currentLineLength.set(0);
                if (ch == ' ') {
                    continue;
                }
            }
            terminal.writer().print(new AttributedString(String.valueOf(ch), style).toAnsi());
            currentLineLength.addAndGet(charWidth);
        }
        terminal.flush();
    }

    private void endAssistantLine() {
        if (assistantOutputStarted.getAndSet(false)) {
            terminal.writer().println();
            terminal.flush();
        }
    }

    private static boolean isWideChar(char ch) {
        return (ch >= 0x4E00 && ch <= 0x9FA5)
                || (ch >= 0x3000 && ch <= 0x303F)
                || (ch >= 0xFF00 && ch <= 0xFFEF);
    }

    static String formatParams(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        String joined = params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
        if (joined.length() > MAX_PARAM_PREVIEW) {
            joined = joined.substring(0, MAX_PARAM_PREVIEW) + "...";
        }
        return " (" + joined + ")";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
