package io.leavesfly.meer.agent;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * 一个磁盘文件对应的发现结果
 */
@Value
public class AgentDiscoveryResult {

    AgentDefinition definition;

    Path sourcePath;

    AgentScope scope;

    Instant lastModified;
}
