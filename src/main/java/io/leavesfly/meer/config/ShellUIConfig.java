package io.leavesfly.meer.config;

import lombok.Data;

/**
 * Shell UI 配置，从 application.yml 的 meer.shell-ui 加载
 */
@Data
public class ShellUIConfig {

    /**
     * 是否显示子代理的步骤
     */
    private boolean showSubagentSteps = true;

    /**
     * 新文件预览的行数
     */
    private int newFilePreviewLines = 20;

    /**
     * 单个 diff 最多显示的行数
     */
    private int maxDiffLines = 200;
}
