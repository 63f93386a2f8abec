package io.leavesfly.meer.cli;

import io.leavesfly.meer.SessionOptions;
import io.leavesfly.meer.config.ShellUIConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CliApplication 参数解析单元测试
 */
class CliApplicationTest {

    @TempDir
    Path workDir;

    @Test
    void testOptionsMapToSessionOptions() {
        CliApplication app = new CliApplication(null, null, new ShellUIConfig());
        new CommandLine(app).parseArgs("-w", workDir.toString(), "-m", "smart", "--yolo", "--max-iterations", "4");

        SessionOptions options = app.buildOptions();

        assertEquals(workDir.toAbsolutePath().normalize(), options.getWorkDir());
        assertEquals("smart", options.getModelName());
        assertEquals(4, options.getMaxIterations());
        assertTrue(options.isYolo());
        assertFalse(options.isDryRun());
    }

    @Test
    void testDefaults() {
        CliApplication app = new CliApplication(null, null, new ShellUIConfig());
        new CommandLine(app).parseArgs("--dry-run");

        SessionOptions options = app.buildOptions();

        assertNull(options.getModelName());
        assertNull(options.getMaxIterations());
        assertTrue(options.isDryRun());
        assertEquals(Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize(), options.getWorkDir());
    }

    @Test
    void testInheritedOptionsReachSubcommands() {
        CliApplication app = new CliApplication(null, null, new ShellUIConfig());
        CommandLine.ParseResult result = new CommandLine(app)
                .parseArgs("delegate", "explorer", "map", "the", "repo", "--yes");

        assertTrue(result.hasSubcommand());
        assertEquals("delegate", result.subcommand().commandSpec().name());
        assertTrue(app.buildOptions().isYolo());
    }
}
