package io.leavesfly.meer.orchestrator;

import io.leavesfly.meer.engine.subagent.SubAgentResult;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 把多个子代理结果汇总为一份文本报告
 */
public final class ResultAggregator {

    private ResultAggregator() {
    }

    public static String aggregate(List<SubAgentResult> results) {
        List<SubAgentResult> successful = results.stream()
                .filter(SubAgentResult::isSuccess)
                .collect(Collectors.toList());
        List<SubAgentResult> failed = results.stream()
                .filter(result -> !result.isSuccess())
                .collect(Collectors.toList());

        StringBuilder report = new StringBuilder();

        if (!successful.isEmpty()) {
            report.append("## Successful Tasks (").append(successful.size()).append(")\n\n");
            for (int i = 0; i < successful.size(); i++) {
                report.append("### Task ").append(i + 1).append('\n')
                        .append(successful.get(i).getSummary()).append("\n\n");
            }
        }

        if (!failed.isEmpty()) {
            report.append("## Failed Tasks (").append(failed.size()).append(")\n\n");
            for (int i = 0; i < failed.size(); i++) {
                report.append("### Task ").append(i + 1).append('\n')
                        .append("❌ ").append(failed.get(i).getError()).append("\n\n");
            }
        }

        long totalTokens = 0;
        long totalDurationMs = 0;
        long totalToolCalls = 0;
        for (SubAgentResult result : results) {
            SubAgentResult.Metadata metadata = result.getMetadata();
            if (metadata == null) {
                continue;
            }
            totalTokens += metadata.getTokensUsed();
            totalDurationMs += metadata.getDurationMs();
            totalToolCalls += metadata.getToolCallCount();
        }

        report.append("## Metrics\n")
                .append("- Total Tokens: ").append(totalTokens).append('\n')
                .append("- Total Duration: ")
                .append(String.format(Locale.ROOT, "%.2fs", totalDurationMs / 1000.0)).append('\n')
                .append("- Total Tool Calls: ").append(totalToolCalls);
        return report.toString();
    }
}
