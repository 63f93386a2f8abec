package io.leavesfly.meer.agent;

import io.leavesfly.meer.config.ConfigLoader;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URL;
import java.nio.file.FileSystemAlreadyExistsException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;

/**
 * Agent 定义的三个存储根目录
 * <p>
 * 以显式句柄注入 AgentRegistry，测试可传入临时目录
 */
@Slf4j
@Getter
public class AgentStoreLocations {

    static final String AGENTS_DIR = "agents";

    private final Path projectDir;
    private final Path userDir;

    /**
     * 内置模板目录，可能为 null
     */
    private final Path builtinDir;

    public AgentStoreLocations(Path projectDir, Path userDir, Path builtinDir) {
        this.projectDir = projectDir;
        this.userDir = userDir;
        this.builtinDir = builtinDir;
    }

    /**
     * 默认位置：&lt;workDir&gt;/.meer/agents、~/.meer/agents、classpath:agents
     */
    public static AgentStoreLocations defaults(Path workDir) {
        return new AgentStoreLocations(
                workDir.resolve(".meer").resolve(AGENTS_DIR),
                ConfigLoader.getMeerHome().resolve(AGENTS_DIR),
                findBuiltinDir());
    }

    public Path dirFor(AgentScope scope) {
        switch (scope) {
            case PROJECT:
                return projectDir;
            case USER:
                return userDir;
            default:
                return builtinDir;
        }
    }

    /**
     * 在类路径中查找 agents 目录；打包为 jar 时通过 zip 文件系统访问
     */
    private static Path findBuiltinDir() {
        try {
            URL resource = AgentStoreLocations.class.getClassLoader().getResource(AGENTS_DIR);
            if (resource == null) {
                log.warn("Built-in agents directory not found on classpath");
                return null;
            }
            URI uri = resource.toURI();
            if ("jar".equals(uri.getScheme())) {
                try {
                    FileSystems.newFileSystem(uri, Collections.emptyMap());
                } catch (FileSystemAlreadyExistsException e) {
                    log.debug("Jar file system already open for {}", uri);
                }
            }
            return Paths.get(uri);
        } catch (Exception e) {
            log.warn("Unable to resolve built-in agents directory", e);
            return null;
        }
    }
}
