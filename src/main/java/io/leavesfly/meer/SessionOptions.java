package io.leavesfly.meer;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

/**
 * 一次命令行会话的启动参数
 */
@Getter
@Builder
public class SessionOptions {

    private final Path workDir;

    /**
     * 模型名，为 null 时使用配置的默认模型
     */
    private final String modelName;

    /**
     * 最大迭代次数，为 null 时使用 loop_control.max_iterations
     */
    private final Integer maxIterations;

    /**
     * 自动应用所有编辑并允许执行命令
     */
    private final boolean yolo;

    /**
     * 只展示编辑，不写入磁盘
     */
    private final boolean dryRun;
}
