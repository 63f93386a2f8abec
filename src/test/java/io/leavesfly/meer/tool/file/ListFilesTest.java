package io.leavesfly.meer.tool.file;

import io.leavesfly.meer.tool.ToolResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ListFiles 单元测试
 */
class ListFilesTest {

    @TempDir
    Path workDir;

    @Test
    void testDirectoriesFirst() throws Exception {
        Files.createDirectories(workDir.resolve("src"));
        Files.writeString(workDir.resolve("a.txt"), "12345");
        Files.writeString(workDir.resolve("README.md"), "");

        ToolResult result = new ListFiles(workDir).execute(new ListFiles.Params("."), "").block();

        assertNotNull(result);
        assertFalse(result.isError());
        assertEquals("Directory: .\n\nsrc/\nREADME.md (0 B)\na.txt (5 B)", result.getOutput());
        assertEquals("1 directories, 2 files", result.getMessage());
    }

    @Test
    void testEmptyDirectory() {
        ToolResult result = new ListFiles(workDir).execute(new ListFiles.Params(""), "").block();

        assertNotNull(result);
        assertEquals("Directory: .\n\n(empty)", result.getOutput());
    }

    @Test
    void testErrors() throws Exception {
        Files.writeString(workDir.resolve("file.txt"), "x");
        ListFiles tool = new ListFiles(workDir);

        assertEquals("Directory not found: missing",
                tool.execute(new ListFiles.Params("missing"), "").block().getMessage());
        assertTrue(tool.execute(new ListFiles.Params("file.txt"), "").block().isError());
        assertTrue(tool.execute(new ListFiles.Params("/etc"), "").block().isError());
    }

    @Test
    void testFormatSize() {
        assertEquals("?", ListFiles.formatSize(-1));
        assertEquals("512 B", ListFiles.formatSize(512));
    }
}
